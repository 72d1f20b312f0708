package com.nayem.courier.error;

import java.util.concurrent.CancellationException;

/**
 * Cancellation was requested before an attempt or while waiting for a retry.
 */
public class DispatchCancelledException extends CancellationException {
    private final Class<?> requestType;
    private final int attempts;

    public DispatchCancelledException(Class<?> requestType, int attempts) {
        super("Execution of '" + requestType.getName() + "' was cancelled after " + attempts + " attempts.");
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
