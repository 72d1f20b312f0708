package com.nayem.courier.handler;

import com.nayem.courier.core.RequestKind;

import java.util.List;

/**
 * Source of the handlers known to the application.
 */
public interface HandlerRegistry {

    /**
     * Returns every handler registered for the exact request and result types.
     * Implementations must not invoke the handlers.
     *
     * @return the matching handlers, possibly empty
     */
    <R> List<HandlerInvocation<R>> lookupAll(RequestKind kind, Class<?> requestType, Class<R> resultType);
}
