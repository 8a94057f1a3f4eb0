package org.caureq.caureqsensorhub.service.anomaly;

/**
 * Deviation of a reading from its sensor's recent history, in standard deviations.
 * {@link #insufficient()} is returned while the sensor is still in cold start and is never anomalous.
 */
public record AnomalyScore(double value, boolean sufficient) {
    private static final AnomalyScore NOT_ENOUGH_DATA = new AnomalyScore(0.0, false);

    public static AnomalyScore of(double sigmas) { return new AnomalyScore(sigmas, true); }

    public static AnomalyScore insufficient() { return NOT_ENOUGH_DATA; }

    public boolean exceeds(double threshold) {
        return sufficient && value > threshold;
    }
}
