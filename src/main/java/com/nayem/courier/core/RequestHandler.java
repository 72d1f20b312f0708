package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the work for one request type.
 * <p>
 * A handler signals failure either by throwing or by completing the returned
 * future exceptionally; both are treated the same by the dispatcher. A handler
 * may be invoked again for the same request when retries are configured.
 * </p>
 *
 * @param <Q> The request type.
 * @param <R> The result type.
 */
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {

    /**
     * Handles the request.
     *
     * @param request           the request, never null
     * @param cancellationToken signals that the caller is no longer interested in the result
     * @return the future result, never null
     */
    CompletableFuture<R> handle(Q request, CancellationToken cancellationToken);
}
