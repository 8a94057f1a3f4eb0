package org.caureq.caureqsensorhub.store;

import java.time.Instant;

/** Inclusive time range; open ends are replaced by the widest representable bounds. */
public record TimeRange(Instant from, Instant to) {
    private static final Instant MIN = Instant.parse("0001-01-01T00:00:00Z");
    private static final Instant MAX = Instant.parse("9999-12-31T23:59:59Z");

    public TimeRange {
        if (from == null) from = MIN;
        if (to == null) to = MAX;
        if (from.isAfter(to)) throw new IllegalArgumentException("range start " + from + " is after end " + to);
    }

    public static TimeRange all() { return new TimeRange(null, null); }

    public boolean contains(Instant ts) {
        return !ts.isBefore(from) && !ts.isAfter(to);
    }
}
