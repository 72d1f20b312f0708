package com.nayem.courier.retry;

/**
 * Defines how the delay between two attempts of the same request grows.
 */
public enum RetryAlgorithm {

    /**
     * No retry is performed. The request fails on the first error.
     */
    NONE("None"),

    /**
     * The delay is multiplied by the exponential base after every failed attempt
     * (e.g. 1s, 2s, 4s, 8s).
     */
    EXPONENTIAL("Exponential"),

    /**
     * The same delay is applied before every retry.
     */
    FIXED("Fixed"),

    /**
     * The delay grows by the base delay after every failed attempt (e.g. 1s, 2s, 3s).
     */
    LINEAR("Linear"),

    /**
     * The delay is drawn uniformly around the base delay, spreading retries of
     * concurrent callers.
     */
    RANDOM("Random");

    private final String displayName;

    RetryAlgorithm(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
