package com.nayem.courier.spring;

import com.nayem.courier.retry.RetryAlgorithm;
import com.nayem.courier.retry.RetrySettings;
import com.nayem.courier.retry.RetrySettingsValidator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.Errors;
import org.springframework.validation.Validator;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the Courier command and query buses.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code courier} prefix. Environment variables such as
 * {@code COURIER_RETRY_ALGORITHM} override them through relaxed binding.
 * </p>
 */
@ConfigurationProperties(prefix = "courier")
@Validated
public class CourierProperties implements Validator {

    /**
     * Retry behaviour shared by commands and queries.
     */
    @Valid
    private Retry retry = new Retry();

    /**
     * Executor running delayed retries.
     */
    @Valid
    private Scheduler scheduler = new Scheduler();

    /**
     * @return the retry configuration
     */
    public Retry getRetry() {
        return retry;
    }

    /**
     * @param retry the retry configuration
     */
    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * @return the scheduler configuration
     */
    public Scheduler getScheduler() {
        return scheduler;
    }

    /**
     * @param scheduler the scheduler configuration
     */
    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean supports(Class<?> clazz) {
        return CourierProperties.class.isAssignableFrom(clazz);
    }

    /**
     * Rejects retry settings whose values conflict with each other, reporting
     * every violation.
     */
    @Override
    public void validate(Object target, Errors errors) {
        Retry retry = ((CourierProperties) target).getRetry();
        boolean inRange = checkRange(errors, "retry.delay", "Delay", retry.getDelay());
        inRange &= checkRange(errors, "retry.randomVariation", "RandomVariation", retry.getRandomVariation());
        inRange &= checkRange(errors, "retry.maximumDelay", "MaximumDelay", retry.getMaximumDelay());
        if (!inRange) {
            return;
        }
        for (String violation : RetrySettingsValidator.validate(retry.toSettings())) {
            errors.reject("courier.retry.invalid", violation);
        }
    }

    private static boolean checkRange(Errors errors, String field, String name, Duration value) {
        if (value == null || Retry.fitsMillis(value)) {
            return true;
        }
        errors.rejectValue(field, "courier.retry.out-of-range",
                "'" + name + "' must be less than or equal to " + Integer.MAX_VALUE + "ms.");
        return false;
    }

    /**
     * Retry configuration. Delays accept durations ("500ms", "2s") or plain
     * numbers interpreted as milliseconds.
     */
    public static class Retry {
        /**
         * How delays grow between attempts.
         */
        private RetryAlgorithm algorithm = RetryAlgorithm.NONE;

        /**
         * Base delay between attempts.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration delay = Duration.ZERO;

        /**
         * Multiplier applied per attempt by the exponential algorithm.
         */
        private int exponentialBase;

        /**
         * Spread around the base delay used by the random algorithm.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration randomVariation = Duration.ZERO;

        /**
         * Retries allowed after the first attempt. 0 means unbounded.
         */
        private int maximumRetries;

        /**
         * Delay above which retries stop. 0 means unbounded.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration maximumDelay = Duration.ZERO;

        /** @return the retry algorithm */
        public RetryAlgorithm getAlgorithm() {
            return algorithm;
        }

        /** @param algorithm the retry algorithm */
        public void setAlgorithm(RetryAlgorithm algorithm) {
            this.algorithm = algorithm;
        }

        /** @return the base delay between attempts */
        public Duration getDelay() {
            return delay;
        }

        /** @param delay the base delay between attempts */
        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        /** @return the exponential multiplier */
        public int getExponentialBase() {
            return exponentialBase;
        }

        /** @param exponentialBase the exponential multiplier */
        public void setExponentialBase(int exponentialBase) {
            this.exponentialBase = exponentialBase;
        }

        /** @return the random spread around the base delay */
        public Duration getRandomVariation() {
            return randomVariation;
        }

        /** @param randomVariation the random spread around the base delay */
        public void setRandomVariation(Duration randomVariation) {
            this.randomVariation = randomVariation;
        }

        /** @return the retries allowed after the first attempt */
        public int getMaximumRetries() {
            return maximumRetries;
        }

        /** @param maximumRetries the retries allowed after the first attempt */
        public void setMaximumRetries(int maximumRetries) {
            this.maximumRetries = maximumRetries;
        }

        /** @return the delay above which retries stop */
        public Duration getMaximumDelay() {
            return maximumDelay;
        }

        /** @param maximumDelay the delay above which retries stop */
        public void setMaximumDelay(Duration maximumDelay) {
            this.maximumDelay = maximumDelay;
        }

        /** @return the bound values as dispatcher settings, delays in milliseconds */
        public RetrySettings toSettings() {
            return RetrySettings.builder()
                    .algorithm(algorithm)
                    .delay(toMillis(delay))
                    .exponentialBase(exponentialBase)
                    .randomVariation(toMillis(randomVariation))
                    .maximumRetries(maximumRetries)
                    .maximumDelay(toMillis(maximumDelay))
                    .build();
        }

        private static int toMillis(Duration duration) {
            return duration == null ? 0 : Math.toIntExact(duration.toMillis());
        }

        static boolean fitsMillis(Duration duration) {
            return duration.compareTo(Duration.ofMillis(Integer.MAX_VALUE)) <= 0
                    && duration.compareTo(Duration.ofMillis(Integer.MIN_VALUE)) >= 0;
        }
    }

    /**
     * Scheduler configuration.
     */
    public static class Scheduler {
        /**
         * Threads running delayed retries. Retried handlers are invoked on these
         * threads.
         */
        @Min(1)
        private int poolSize = 1;

        /**
         * Prefix for scheduler thread names. Useful for monitoring and debugging.
         */
        @NotBlank
        private String threadNamePrefix = "courier-retry-";

        /** @return the scheduler pool size */
        public int getPoolSize() {
            return poolSize;
        }

        /** @param poolSize the scheduler pool size */
        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        /** @return the thread name prefix */
        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        /** @param threadNamePrefix the thread name prefix */
        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
