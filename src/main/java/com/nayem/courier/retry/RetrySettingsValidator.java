package com.nayem.courier.retry;

import com.nayem.courier.error.InvalidRetrySettingsException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a {@link RetrySettings} combination is consistent.
 * <p>
 * Every rule is evaluated and all violations are reported together, in this
 * order: delay ranges, algorithm-specific rules, algorithm validity, retry count.
 * </p>
 */
public final class RetrySettingsValidator {

    private RetrySettingsValidator() {
    }

    /**
     * @return the violations, empty when the settings are valid
     */
    public static List<String> validate(RetrySettings settings) {
        List<String> violations = new ArrayList<>();

        if (settings.delay() < 0) {
            violations.add("'Delay' must be greater than or equal to 0.");
        }
        if (settings.maximumDelay() < 0) {
            violations.add("'MaximumDelay' must be greater than or equal to 0.");
        }

        RetryAlgorithm algorithm = settings.algorithm();
        if (algorithm == null) {
            violations.add("'Algorithm' is not a valid retry algorithm.");
        } else {
            switch (algorithm) {
                case EXPONENTIAL -> {
                    requirePositiveDelay(settings, violations);
                    if (settings.exponentialBase() <= 1) {
                        violations.add("'ExponentialBase' must be greater than 1.");
                    }
                }
                case LINEAR -> {
                    if (settings.delay() <= 0) {
                        requirePositiveDelay(settings, violations);
                    } else {
                        requireNoMaximumDelay(settings, violations);
                    }
                }
                case RANDOM -> {
                    requirePositiveDelay(settings, violations);
                    if (settings.randomVariation() <= 0) {
                        violations.add("'RandomVariation' must be greater than 0.");
                    } else if (settings.randomVariation() > settings.delay()) {
                        violations.add("'RandomVariation' must be less than or equal to 'Delay'.");
                    }
                    requireNoMaximumDelay(settings, violations);
                }
                case FIXED, NONE -> {
                    // no additional constraint
                }
            }
        }

        if (settings.maximumRetries() < 0) {
            violations.add("'MaximumRetries' must be greater than or equal to 0.");
        }
        return violations;
    }

    /**
     * @throws InvalidRetrySettingsException listing every violation
     */
    public static void ensureValid(RetrySettings settings) {
        List<String> violations = validate(settings);
        if (!violations.isEmpty()) {
            throw new InvalidRetrySettingsException(violations);
        }
    }

    private static void requirePositiveDelay(RetrySettings settings, List<String> violations) {
        if (settings.delay() <= 0) {
            violations.add("'Delay' must be greater than 0.");
        }
    }

    private static void requireNoMaximumDelay(RetrySettings settings, List<String> violations) {
        if (settings.maximumDelay() != 0) {
            violations.add("'MaximumDelay' must be 0 when 'Algorithm' is "
                    + settings.algorithm().getDisplayName() + ".");
        }
    }
}
