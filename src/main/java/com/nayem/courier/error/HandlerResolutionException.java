package com.nayem.courier.error;

import com.nayem.courier.core.RequestKind;

import java.util.Locale;

/**
 * Zero or several handlers are registered for a request type. Never retried.
 */
public class HandlerResolutionException extends DispatchException {
    private final RequestKind requestKind;
    private final Class<?> requestType;
    private final int handlerCount;

    public HandlerResolutionException(RequestKind requestKind, Class<?> requestType, int handlerCount) {
        super(format(requestKind, requestType, handlerCount));
        this.requestKind = requestKind;
        this.requestType = requestType;
        this.handlerCount = handlerCount;
    }

    public RequestKind getRequestKind() {
        return requestKind;
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public int getHandlerCount() {
        return handlerCount;
    }

    private static String format(RequestKind requestKind, Class<?> requestType, int handlerCount) {
        StringBuilder message = new StringBuilder("Exactly one handler was expected for ")
                .append(requestKind.getDisplayName().toLowerCase(Locale.ROOT))
                .append(" of type '").append(requestType.getName()).append("', but ");
        if (handlerCount < 1) {
            message.append("none was found.");
        } else {
            message.append(handlerCount).append(" were found.");
        }
        return message.toString();
    }
}
