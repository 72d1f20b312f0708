package com.nayem.courier.core;

/**
 * A request expected to change state. Use {@link Unit} as the result type when
 * there is nothing to return.
 *
 * @param <R> The result type.
 */
public interface Command<R> extends Request<R> {
}
