package org.caureq.caureqsensorhub.api.dto;

import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.domain.SensorType;

import java.time.Instant;

public record SensorDTO(String id, SensorType type, String name, String location, Instant createdAt) {
    public static SensorDTO of(Sensor s) {
        return new SensorDTO(s.getId(), s.getType(), s.getName(), s.getLocation(), s.getCreatedAt());
    }
}
