package com.nayem.courier.retry;

import com.nayem.courier.core.Request;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failed attempt may be retried.
 * <p>
 * Not every failure is transient: a handler reporting a permanent condition
 * (such as {@link UnsupportedOperationException}) should not be invoked again.
 * </p>
 */
@FunctionalInterface
public interface RetryPredicate {

    boolean shouldRetry(Request<?> request, Throwable error);

    default RetryPredicate and(RetryPredicate other) {
        Objects.requireNonNull(other, "other");
        return (request, error) -> shouldRetry(request, error) && other.shouldRetry(request, error);
    }

    /**
     * Retries every failure. This is the default.
     */
    static RetryPredicate always() {
        return (request, error) -> true;
    }

    static RetryPredicate never() {
        return (request, error) -> false;
    }

    /**
     * Refuses to retry when the error, or any of its causes, is an instance of
     * one of the given types.
     */
    @SafeVarargs
    static RetryPredicate nonRetryable(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> nonRetryable = List.of(types);
        return (request, error) -> {
            for (Throwable current = error; current != null; current = current.getCause()) {
                for (Class<? extends Throwable> type : nonRetryable) {
                    if (type.isInstance(current)) {
                        return false;
                    }
                }
                if (current.getCause() == current) {
                    break;
                }
            }
            return true;
        };
    }
}
