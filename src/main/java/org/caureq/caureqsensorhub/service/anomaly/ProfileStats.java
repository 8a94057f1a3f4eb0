package org.caureq.caureqsensorhub.service.anomaly;

/** Read-only copy of one sensor's rolling profile. */
public record ProfileStats(String sensorId, int count, double mean, double stdDev) {}
