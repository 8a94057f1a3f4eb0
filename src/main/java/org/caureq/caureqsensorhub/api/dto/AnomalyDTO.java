package org.caureq.caureqsensorhub.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.caureq.caureqsensorhub.service.rules.AnomalySettings;

public record AnomalyDTO(
        @DecimalMin(value = "0.0", inclusive = false) double scoreThreshold,
        @Min(1) int minSamples,
        @Min(2) int windowSize
) {
    public static AnomalyDTO of(AnomalySettings s) {
        return new AnomalyDTO(s.scoreThreshold(), s.minSamples(), s.windowSize());
    }

    public AnomalySettings toSettings() {
        return new AnomalySettings(scoreThreshold, minSamples, windowSize);
    }
}
