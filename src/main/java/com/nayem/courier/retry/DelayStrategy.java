package com.nayem.courier.retry;

import com.nayem.courier.core.Request;

/**
 * Computes how long to wait before the next attempt of a failed request.
 * <p>
 * A negative result is rejected by the dispatcher as a configuration error.
 * </p>
 */
@FunctionalInterface
public interface DelayStrategy {

    long delayMillis(Request<?> request, Throwable error, int attempt);

    /**
     * Delays computed by the given calculator from the retry settings.
     */
    static DelayStrategy backoff(RetrySettings settings, BackoffCalculator calculator) {
        return (request, error, attempt) -> calculator.delayMillis(settings, attempt);
    }
}
