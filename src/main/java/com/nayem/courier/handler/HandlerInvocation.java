package com.nayem.courier.handler;

import com.nayem.courier.core.CancellationToken;
import com.nayem.courier.core.Request;

import java.util.concurrent.CompletableFuture;

/**
 * A handler bound to the request type it was registered for.
 *
 * @param <R> The result type.
 */
@FunctionalInterface
public interface HandlerInvocation<R> {

    /**
     * @throws com.nayem.courier.error.InvocationContractException if the request
     *         is not of the registered type
     */
    CompletableFuture<R> invoke(Request<R> request, CancellationToken cancellationToken);
}
