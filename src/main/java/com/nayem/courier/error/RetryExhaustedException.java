package com.nayem.courier.error;

import com.nayem.courier.core.RequestKind;

/**
 * A request kept failing until the retry settings stopped further attempts. The
 * cause is the error of the last attempt.
 */
public class RetryExhaustedException extends DispatchException {
    private final Class<?> requestType;
    private final int attempts;

    public RetryExhaustedException(RequestKind requestKind, Class<?> requestType, int attempts, Throwable cause) {
        super(requestKind.getDisplayName() + " '" + requestType.getName() + "' execution failed after " + attempts
                + " attempts. See the cause for more detail.", cause);
        this.requestType = requestType;
        this.attempts = attempts;
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public int getAttempts() {
        return attempts;
    }
}
