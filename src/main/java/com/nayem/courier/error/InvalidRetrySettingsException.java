package com.nayem.courier.error;

import java.util.List;

/**
 * The retry settings combine values that conflict with each other. Raised before
 * any handler is invoked.
 */
public class InvalidRetrySettingsException extends DispatchException {
    private final List<String> violations;

    public InvalidRetrySettingsException(List<String> violations) {
        super(format(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String format(List<String> violations) {
        StringBuilder message = new StringBuilder("Validation failed.");
        for (String violation : violations) {
            message.append('\n').append(" - ").append(violation);
        }
        return message.toString();
    }
}
