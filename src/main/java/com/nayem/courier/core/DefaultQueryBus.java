package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

public class DefaultQueryBus implements QueryBus {

    private final RequestDispatcher dispatcher;

    public DefaultQueryBus(RequestDispatcher dispatcher) {
        if (dispatcher.getKind() != RequestKind.QUERY) {
            throw new IllegalArgumentException("A query bus requires a QUERY dispatcher, got " + dispatcher.getKind());
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public <R> CompletableFuture<R> execute(Query<R> query, CancellationToken cancellationToken) {
        return dispatcher.dispatch(query, cancellationToken);
    }
}
