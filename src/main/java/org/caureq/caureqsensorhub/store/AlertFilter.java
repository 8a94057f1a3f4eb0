package org.caureq.caureqsensorhub.store;

import java.time.Instant;

/**
 * Alert query parameters. Null sensorId / acknowledged mean "any";
 * limit is clamped to [1, 500] as for the REST surface.
 */
public record AlertFilter(String sensorId, Boolean acknowledged, Instant since, int limit, int offset) {
    public AlertFilter {
        if (sensorId != null && sensorId.isBlank()) sensorId = null;
        if (since == null) since = Instant.EPOCH;
        limit = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        offset = Math.max(0, offset);
    }

    public static AlertFilter recent(int limit) {
        return new AlertFilter(null, null, null, limit, 0);
    }
}
