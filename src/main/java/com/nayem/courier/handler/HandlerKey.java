package com.nayem.courier.handler;

import com.nayem.courier.core.RequestKind;

import java.util.Objects;

/**
 * Identifies the handlers able to process one request type and produce one
 * result type.
 */
public record HandlerKey(RequestKind kind, Class<?> requestType, Class<?> resultType) {

    public HandlerKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requestType, "requestType");
        Objects.requireNonNull(resultType, "resultType");
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "[" + requestType.getName() + " -> " + resultType.getName() + "]";
    }
}
