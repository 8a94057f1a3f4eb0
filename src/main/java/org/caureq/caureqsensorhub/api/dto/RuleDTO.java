package org.caureq.caureqsensorhub.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.service.rules.AlertRule;

import java.time.Duration;

/** One threshold rule; a null bound is not checked, a null cooldown takes the default. */
public record RuleDTO(
        @NotBlank String type,
        Double min,
        Double max,
        @PositiveOrZero Long cooldownSeconds
) {
    public static RuleDTO of(SensorType type, AlertRule rule) {
        return new RuleDTO(type.code(), rule.min(), rule.max(), rule.cooldown().toSeconds());
    }

    public AlertRule toRule(Duration defaultCooldown) {
        return new AlertRule(min, max, cooldownSeconds == null ? defaultCooldown : Duration.ofSeconds(cooldownSeconds));
    }
}
