package com.nayem.courier.core;

/**
 * A request dispatched to exactly one handler.
 * <p>
 * The runtime class identifies the request and {@code R} declares the type of
 * the result. Implementations should be immutable; the dispatcher never mutates
 * them.
 * </p>
 *
 * @param <R> The result type.
 */
public interface Request<R> {
}
