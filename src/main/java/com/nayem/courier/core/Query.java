package com.nayem.courier.core;

/**
 * A request expected to read state only.
 *
 * @param <R> The result type.
 */
public interface Query<R> extends Request<R> {
}
