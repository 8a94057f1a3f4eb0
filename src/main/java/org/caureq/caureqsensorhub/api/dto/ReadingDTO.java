package org.caureq.caureqsensorhub.api.dto;

import org.caureq.caureqsensorhub.domain.Reading;

import java.time.Instant;

public record ReadingDTO(String sensorId, Instant timestamp, double value, String unit) {
    public static ReadingDTO of(Reading r) {
        return new ReadingDTO(r.getSensorId(), r.getTs(), r.getValue(), r.getUnit());
    }
}
