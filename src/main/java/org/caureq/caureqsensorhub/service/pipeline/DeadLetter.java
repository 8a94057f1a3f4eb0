package org.caureq.caureqsensorhub.service.pipeline;

import java.time.Instant;

/**
 * A write the core gave up on after exhausting its retries.
 *
 * @param eventTs   timestamp of the reading or alert that could not be stored
 * @param recordedAt when the core gave up
 */
public record DeadLetter(Kind kind, String sensorId, String refId, Instant eventTs, double value,
                         int attempts, String error, Instant recordedAt) {
    public enum Kind { READING, ALERT }
}
