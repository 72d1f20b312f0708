package com.nayem.courier.retry;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Computes the delay to wait before retrying a failed attempt.
 * <p>
 * Apart from the draw made by {@link RetryAlgorithm#RANDOM}, the calculation is
 * a pure function of the settings and the attempt number. The randomness source
 * is supplied per call so that a thread-confined generator such as
 * {@link ThreadLocalRandom} can be used safely from concurrent dispatches.
 * </p>
 */
public class BackoffCalculator {

    private final Supplier<? extends Random> randomSource;

    public BackoffCalculator() {
        this(ThreadLocalRandom::current);
    }

    public BackoffCalculator(Supplier<? extends Random> randomSource) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
    }

    /**
     * Calculates the retry delay for the given attempt.
     *
     * @param settings the retry settings
     * @param attempt  the attempt that just failed, starting at 1
     * @return the delay in milliseconds, 0 when the retry should happen
     *         immediately or when the settings do not produce a positive delay
     */
    public long delayMillis(RetrySettings settings, int attempt) {
        int delay = settings.delay();
        if (delay <= 0 || settings.algorithm() == null) {
            return 0;
        }

        return switch (settings.algorithm()) {
            case EXPONENTIAL -> settings.exponentialBase() > 1
                    ? exponentialDelay(delay, settings.exponentialBase(), attempt)
                    : 0;
            case FIXED -> delay;
            case LINEAR -> (long) delay * attempt;
            case RANDOM -> randomDelay(delay, settings.randomVariation());
            case NONE -> 0;
        };
    }

    /**
     * {@code delay * base^(attempt - 1)} in exact integer arithmetic, saturating at
     * {@link Long#MAX_VALUE}.
     */
    private static long exponentialDelay(int delay, int base, int attempt) {
        long result = delay;
        for (int i = 1; i < attempt; i++) {
            if (result > Long.MAX_VALUE / base) {
                return Long.MAX_VALUE;
            }
            result *= base;
        }
        return result;
    }

    private long randomDelay(int delay, int variation) {
        if (variation <= 0 || variation >= delay) {
            return 0;
        }
        long minimum = (long) delay - variation;
        long maximum = (long) delay + variation;
        return randomSource.get().nextLong(minimum, maximum + 1);
    }
}
