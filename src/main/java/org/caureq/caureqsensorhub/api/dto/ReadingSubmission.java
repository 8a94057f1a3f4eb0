package org.caureq.caureqsensorhub.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import org.caureq.caureqsensorhub.service.ingest.RawReading;

/**
 * Body of a pushed reading. Field checks are left to the ingest gateway so that both
 * transports reject the same input for the same reason.
 */
public record ReadingSubmission(
        @JsonAlias("sensor_id") String sensorId,
        @JsonAlias("sensor_type") String type,
        String name,
        String location,
        Double value,
        String unit,
        String timestamp
) {
    public RawReading toRaw() {
        return new RawReading(sensorId, type, name, location, value, unit, timestamp);
    }
}
