package com.nayem.courier.retry;

import com.nayem.courier.core.RequestKind;

/**
 * Receives an event each time a failed attempt is about to be retried.
 * Implementations must not block.
 */
public interface RetryListener {

    /**
     * @return whether {@link #onRetry} should be called at all
     */
    default boolean isEnabled() {
        return true;
    }

    void onRetry(RequestKind kind, Class<?> requestType, int attempt, long delayMillis, Throwable error);

    static RetryListener noOp() {
        return NoOpRetryListener.INSTANCE;
    }

    final class NoOpRetryListener implements RetryListener {
        private static final NoOpRetryListener INSTANCE = new NoOpRetryListener();

        private NoOpRetryListener() {
        }

        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void onRetry(RequestKind kind, Class<?> requestType, int attempt, long delayMillis, Throwable error) {
        }
    }
}
