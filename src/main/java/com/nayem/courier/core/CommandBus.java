package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for sending commands.
 */
public interface CommandBus {

    /**
     * Executes the command with its registered handler.
     *
     * @param command           the command to execute
     * @param cancellationToken cancels retries and pending waits
     * @return the command result
     */
    <R> CompletableFuture<R> execute(Command<R> command, CancellationToken cancellationToken);

    default <R> CompletableFuture<R> execute(Command<R> command) {
        return execute(command, CancellationToken.none());
    }
}
