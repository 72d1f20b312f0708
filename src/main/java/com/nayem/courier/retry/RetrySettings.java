package com.nayem.courier.retry;

/**
 * Immutable retry configuration shared by the command and query dispatchers.
 * <p>
 * Delays are expressed in milliseconds. A {@code maximumRetries} or
 * {@code maximumDelay} of 0 means "unbounded".
 * </p>
 *
 * @param algorithm       how delays grow between attempts
 * @param delay           base delay in milliseconds
 * @param exponentialBase multiplier applied per attempt, only used by {@link RetryAlgorithm#EXPONENTIAL}
 * @param randomVariation spread around the base delay, only used by {@link RetryAlgorithm#RANDOM}
 * @param maximumRetries  number of retries allowed after the first attempt
 * @param maximumDelay    ceiling above which a computed delay stops the retries
 */
public record RetrySettings(
        RetryAlgorithm algorithm,
        int delay,
        int exponentialBase,
        int randomVariation,
        int maximumRetries,
        int maximumDelay) {

    private static final RetrySettings NONE = builder().build();

    /**
     * Settings that never retry.
     */
    public static RetrySettings none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetryAlgorithm algorithm = RetryAlgorithm.NONE;
        private int delay;
        private int exponentialBase;
        private int randomVariation;
        private int maximumRetries;
        private int maximumDelay;

        public Builder algorithm(RetryAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder delay(int delay) {
            this.delay = delay;
            return this;
        }

        public Builder exponentialBase(int exponentialBase) {
            this.exponentialBase = exponentialBase;
            return this;
        }

        public Builder randomVariation(int randomVariation) {
            this.randomVariation = randomVariation;
            return this;
        }

        public Builder maximumRetries(int maximumRetries) {
            this.maximumRetries = maximumRetries;
            return this;
        }

        public Builder maximumDelay(int maximumDelay) {
            this.maximumDelay = maximumDelay;
            return this;
        }

        public RetrySettings build() {
            return new RetrySettings(algorithm, delay, exponentialBase, randomVariation, maximumRetries,
                    maximumDelay);
        }
    }
}
