package org.caureq.caureqsensorhub.service.rules;

/**
 * @param scoreThreshold a score strictly above this is anomalous
 * @param minSamples     prior readings a sensor needs before it is scored at all
 * @param windowSize     readings kept in each sensor's rolling profile
 */
public record AnomalySettings(double scoreThreshold, int minSamples, int windowSize) {
    public AnomalySettings {
        if (!(scoreThreshold > 0) || Double.isInfinite(scoreThreshold)) {
            throw new IllegalArgumentException("scoreThreshold must be a positive finite number");
        }
        if (minSamples < 1) throw new IllegalArgumentException("minSamples must be >= 1");
        if (windowSize < 2) throw new IllegalArgumentException("windowSize must be >= 2");
        if (minSamples > windowSize) {
            throw new IllegalArgumentException("minSamples %d exceeds windowSize %d".formatted(minSamples, windowSize));
        }
    }
}
