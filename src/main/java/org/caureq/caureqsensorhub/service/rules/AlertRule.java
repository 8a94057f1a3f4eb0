package org.caureq.caureqsensorhub.service.rules;

import java.time.Duration;

/**
 * Inclusive bounds and cooldown for one sensor type. A null bound is not checked.
 */
public record AlertRule(Double min, Double max, Duration cooldown) {
    public AlertRule {
        if (cooldown == null || cooldown.isNegative()) throw new IllegalArgumentException("cooldown must be >= 0");
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min %s is greater than max %s".formatted(min, max));
        }
    }

    public static AlertRule unbounded(Duration cooldown) {
        return new AlertRule(null, null, cooldown);
    }

    public boolean isBelowMin(double value) { return min != null && value < min; }

    public boolean isAboveMax(double value) { return max != null && value > max; }
}
