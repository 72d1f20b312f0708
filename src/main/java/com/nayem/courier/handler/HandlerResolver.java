package com.nayem.courier.handler;

import com.nayem.courier.core.Request;
import com.nayem.courier.core.RequestKind;
import com.nayem.courier.error.HandlerResolutionException;

import java.util.List;
import java.util.Objects;

/**
 * Finds the single handler responsible for a request.
 */
public class HandlerResolver {

    private final HandlerRegistry registry;

    public HandlerResolver(HandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Resolves the handler of a request from its runtime class and declared result type.
     *
     * @throws HandlerResolutionException when zero or several handlers match
     */
    @SuppressWarnings("unchecked")
    public <R> HandlerInvocation<R> resolve(RequestKind kind, Request<R> request) {
        Class<?> requestType = request.getClass();
        Class<R> resultType = (Class<R>) RequestTypes.resultType(requestType);
        return resolve(kind, requestType, resultType);
    }

    /**
     * @throws HandlerResolutionException when zero or several handlers match
     */
    public <R> HandlerInvocation<R> resolve(RequestKind kind, Class<?> requestType, Class<R> resultType) {
        List<HandlerInvocation<R>> handlers = registry.lookupAll(kind, requestType, resultType);
        if (handlers.size() != 1) {
            throw new HandlerResolutionException(kind, requestType, handlers.size());
        }
        return handlers.get(0);
    }
}
