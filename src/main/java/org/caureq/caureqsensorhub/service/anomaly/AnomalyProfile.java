package org.caureq.caureqsensorhub.service.anomaly;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling mean/variance over the last N values of one sensor.
 *
 * Uses Welford's update for insertions and its inverse for evictions; after every
 * full window of evictions the moments are recomputed from the window with a two-pass
 * sum so rounding error cannot accumulate over a long-lived stream.
 */
final class AnomalyProfile {
    private static final double VARIANCE_EPS = 1e-12;
    private static final double EQUAL_EPS = 1e-9;

    private final Deque<Double> window = new ArrayDeque<>();
    private double mean;
    private double m2;
    private int evictions;

    /** Scores {@code x} against the current state; does not fold it in. */
    synchronized AnomalyScore score(double x, int minSamples) {
        int n = window.size();
        if (n < minSamples) return AnomalyScore.insufficient();
        double variance = Math.max(0.0, m2 / n);
        double scale = Math.max(1.0, Math.abs(mean));
        if (variance <= VARIANCE_EPS * scale * scale) {
            // flat history: any change at all is a deviation
            return Math.abs(x - mean) <= EQUAL_EPS * scale
                    ? AnomalyScore.of(0.0)
                    : AnomalyScore.of(Double.POSITIVE_INFINITY);
        }
        return AnomalyScore.of(Math.abs(x - mean) / Math.sqrt(variance));
    }

    synchronized void add(double x, int windowSize) {
        window.addLast(x);
        int n = window.size();
        double delta = x - mean;
        mean += delta / n;
        m2 += delta * (x - mean);
        while (window.size() > windowSize) {
            evict(window.removeFirst());
        }
        if (evictions >= windowSize) {
            rebase();
        }
    }

    private void evict(double x) {
        int n = window.size();
        evictions++;
        if (n == 0) {
            mean = 0.0;
            m2 = 0.0;
            return;
        }
        double delta = x - mean;
        mean -= delta / n;
        m2 -= delta * (x - mean);
    }

    private void rebase() {
        int n = window.size();
        double sum = 0.0;
        for (double v : window) sum += v;
        double mu = sum / n;
        double acc = 0.0;
        for (double v : window) acc += (v - mu) * (v - mu);
        mean = mu;
        m2 = acc;
        evictions = 0;
    }

    synchronized ProfileStats stats(String sensorId) {
        int n = window.size();
        double sd = n == 0 ? 0.0 : Math.sqrt(Math.max(0.0, m2 / n));
        return new ProfileStats(sensorId, n, mean, sd);
    }
}
