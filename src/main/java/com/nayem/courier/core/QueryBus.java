package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for sending queries.
 */
public interface QueryBus {

    /**
     * Executes the query with its registered handler.
     *
     * @param query             the query to execute
     * @param cancellationToken cancels retries and pending waits
     * @return the query result
     */
    <R> CompletableFuture<R> execute(Query<R> query, CancellationToken cancellationToken);

    default <R> CompletableFuture<R> execute(Query<R> query) {
        return execute(query, CancellationToken.none());
    }
}
