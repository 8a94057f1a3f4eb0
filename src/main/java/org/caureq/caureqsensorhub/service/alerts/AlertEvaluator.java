package org.caureq.caureqsensorhub.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.service.anomaly.AnomalyScore;
import org.caureq.caureqsensorhub.service.rules.AlertRule;
import org.caureq.caureqsensorhub.service.rules.RuleStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which alerts a reading raises and owns the cooldown bookkeeping.
 *
 * Every (sensor, kind) pair runs its own Clear -> Raised -> Cooling -> Clear machine:
 * - condition true, no cooldown pending: emit and start cooling until ts + rule.cooldown
 * - condition true, still cooling: suppressed
 * - condition true, cooldown elapsed: emit again and restart cooling
 * - condition false: back to Clear at once, discarding any pending cooldown
 *
 * Time is the reading's own timestamp. Calls for one sensor are serialized by the
 * processing core; the map is concurrent because different sensors run in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEvaluator {
    private final RuleStore ruleStore;
    private final Map<CooldownKey, Instant> coolingUntil = new ConcurrentHashMap<>();

    private record CooldownKey(String sensorId, AlertKind kind) {}

    /** Alerts to raise for this reading (not yet persisted); empty when nothing fires. */
    public List<AlertRecord> evaluate(Sensor sensor, Reading reading, AnomalyScore score) {
        var snapshot = ruleStore.snapshot();
        var rule = snapshot.ruleFor(sensor.getType());
        double threshold = snapshot.anomaly().scoreThreshold();
        double v = reading.getValue();

        List<AlertRecord> out = new ArrayList<>(2);
        step(sensor, reading, AlertKind.BELOW_MIN, rule.isBelowMin(v), rule, rule.min(), null, out);
        step(sensor, reading, AlertKind.ABOVE_MAX, rule.isAboveMax(v), rule, rule.max(), null, out);
        step(sensor, reading, AlertKind.ANOMALY, score.exceeds(threshold), rule, threshold,
                score.sufficient() ? score.value() : null, out);
        return out;
    }

    public AlertState state(String sensorId, AlertKind kind) {
        return coolingUntil.containsKey(new CooldownKey(sensorId, kind)) ? AlertState.COOLING : AlertState.CLEAR;
    }

    private void step(Sensor sensor, Reading reading, AlertKind kind, boolean condition, AlertRule rule,
                      Double threshold, Double score, List<AlertRecord> out) {
        var key = new CooldownKey(sensor.getId(), kind);
        if (!condition) {
            if (coolingUntil.remove(key) != null) {
                log.debug("{} {} recovered, cooldown cleared", sensor.getId(), kind);
            }
            return;
        }
        var ts = reading.getTs();
        var until = coolingUntil.get(key);
        if (until != null && ts.isBefore(until)) {
            log.debug("{} {} suppressed until {}", sensor.getId(), kind, until);
            return;
        }
        coolingUntil.put(key, ts.plus(rule.cooldown()));
        out.add(AlertRecord.builder()
                .id(UUID.randomUUID().toString())
                .sensorId(sensor.getId())
                .readingId(reading.getId())
                .kind(kind)
                .ts(ts)
                .valueAtTrigger(reading.getValue())
                .threshold(threshold)
                .score(score)
                .message(AlertMessages.describe(sensor, reading, kind, threshold, score))
                .acknowledged(false)
                .build());
    }
}
