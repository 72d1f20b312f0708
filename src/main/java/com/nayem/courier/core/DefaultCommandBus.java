package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

public class DefaultCommandBus implements CommandBus {

    private final RequestDispatcher dispatcher;

    public DefaultCommandBus(RequestDispatcher dispatcher) {
        if (dispatcher.getKind() != RequestKind.COMMAND) {
            throw new IllegalArgumentException("A command bus requires a COMMAND dispatcher, got " + dispatcher.getKind());
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public <R> CompletableFuture<R> execute(Command<R> command, CancellationToken cancellationToken) {
        return dispatcher.dispatch(command, cancellationToken);
    }
}
