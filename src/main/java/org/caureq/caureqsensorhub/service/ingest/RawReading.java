package org.caureq.caureqsensorhub.service.ingest;

/**
 * A reading as delivered by a transport, before validation. Every field may be missing.
 *
 * @param timestamp ISO-8601 instant / offset date-time / UTC local date-time, or epoch millis; null = arrival time
 */
public record RawReading(String sensorId, String type, String name, String location,
                         Double value, String unit, String timestamp) {}
