package com.nayem.courier.core;

/**
 * Handles one query type. Beans implementing this interface are registered
 * automatically by the Spring auto-configuration.
 *
 * @param <Q> The query type.
 * @param <R> The result type.
 */
@FunctionalInterface
public interface QueryHandler<Q extends Query<R>, R> extends RequestHandler<Q, R> {
}
