package org.caureq.caureqsensorhub.service.alerts;

import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;

import java.util.Locale;

final class AlertMessages {
    private AlertMessages() {}

    static String describe(Sensor sensor, Reading reading, AlertKind kind, Double threshold, Double score) {
        var type = sensor.getType().code().replace('_', ' ');
        var unit = reading.getUnit() == null ? "" : reading.getUnit();
        return switch (kind) {
            case BELOW_MIN -> String.format(Locale.ROOT, "Low %s alert: %.2f%s is below threshold of %.2f%s",
                    type, reading.getValue(), unit, threshold, unit);
            case ABOVE_MAX -> String.format(Locale.ROOT, "High %s alert: %.2f%s is above threshold of %.2f%s",
                    type, reading.getValue(), unit, threshold, unit);
            case ANOMALY -> score != null && Double.isInfinite(score)
                    ? String.format(Locale.ROOT, "Anomalous %s: %.2f%s departs from a flat history",
                            type, reading.getValue(), unit)
                    : String.format(Locale.ROOT, "Anomalous %s: %.2f%s is %.1f sigma from recent mean (> %.1f)",
                            type, reading.getValue(), unit, score, threshold);
        };
    }
}
