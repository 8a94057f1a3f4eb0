package org.caureq.caureqsensorhub.api.dto;

import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.AlertRecord;

import java.time.Instant;

public record AlertDTO(String id, String sensorId, Long readingId, AlertKind kind, Instant timestamp, double value,
                       Double threshold, Double score, String message, boolean acknowledged) {
    public static AlertDTO of(AlertRecord a) {
        return new AlertDTO(a.getId(), a.getSensorId(), a.getReadingId(), a.getKind(), a.getTs(), a.getValueAtTrigger(),
                a.getThreshold(), a.getScore(), a.getMessage(), a.isAcknowledged());
    }
}
