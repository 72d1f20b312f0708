package com.nayem.courier.core;

/**
 * Handles one command type. Beans implementing this interface are registered
 * automatically by the Spring auto-configuration.
 *
 * @param <C> The command type.
 * @param <R> The result type.
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> extends RequestHandler<C, R> {
}
