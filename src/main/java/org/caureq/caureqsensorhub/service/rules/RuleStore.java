package org.caureq.caureqsensorhub.service.rules;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runtime alerting configuration. Initialized from {@code app.rules} / {@code app.anomaly}
 * and hot-reloadable through the admin API.
 *
 * Readers take the current immutable snapshot without locking; writers build a new
 * snapshot under the instance monitor and publish it with a single volatile write.
 */
@Slf4j
@Service
public class RuleStore {
    private volatile RuleSnapshot snapshot;

    public RuleStore(AppProps props) {
        var rp = props.rules();
        var rules = new EnumMap<SensorType, AlertRule>(SensorType.class);
        // shipped defaults, overridden by configuration
        rules.put(SensorType.TEMPERATURE, new AlertRule(10.0, 30.0, rp.defaultCooldown()));
        rules.put(SensorType.HUMIDITY, new AlertRule(20.0, 80.0, rp.defaultCooldown()));
        for (var e : rp.byType().entrySet()) {
            var type = SensorType.resolve(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("app.rules.by-type: unknown sensor type " + e.getKey()));
            var r = e.getValue();
            var cooldown = r.cooldown() != null ? r.cooldown() : rp.defaultCooldown();
            rules.put(type, new AlertRule(r.min(), r.max(), cooldown));
        }
        var ap = props.anomaly();
        this.snapshot = new RuleSnapshot(rules, AlertRule.unbounded(rp.defaultCooldown()),
                new AnomalySettings(ap.scoreThreshold(), ap.minSamples(), ap.windowSize()));
        log.info("[Rules] loaded {} rule(s), anomaly={}", rules.size(), snapshot.anomaly());
    }

    public RuleSnapshot snapshot() { return snapshot; }

    /** Most recently configured rule for the type, or the unbounded default rule. */
    public AlertRule ruleFor(SensorType type) { return snapshot.ruleFor(type); }

    public AnomalySettings anomaly() { return snapshot.anomaly(); }

    public synchronized void putRule(SensorType type, AlertRule rule) {
        var rules = new EnumMap<SensorType, AlertRule>(SensorType.class);
        rules.putAll(snapshot.rules());
        rules.put(type, rule);
        snapshot = new RuleSnapshot(rules, snapshot.defaultRule(), snapshot.anomaly());
        log.info("[Rules] {} updated -> {}", type.code(), rule);
    }

    /** Drops the type's rule so it falls back to the default (unbounded) rule. */
    public synchronized boolean removeRule(SensorType type) {
        if (!snapshot.rules().containsKey(type)) return false;
        var rules = new EnumMap<SensorType, AlertRule>(SensorType.class);
        rules.putAll(snapshot.rules());
        rules.remove(type);
        snapshot = new RuleSnapshot(rules, snapshot.defaultRule(), snapshot.anomaly());
        log.info("[Rules] {} removed", type.code());
        return true;
    }

    /** Replaces every per-type rule at once. */
    public synchronized void replaceRules(Map<SensorType, AlertRule> rules) {
        snapshot = new RuleSnapshot(rules, snapshot.defaultRule(), snapshot.anomaly());
        log.info("[Rules] replaced, {} rule(s)", rules.size());
    }

    public synchronized void updateDefaultCooldown(Duration cooldown) {
        snapshot = new RuleSnapshot(snapshot.rules(), AlertRule.unbounded(cooldown), snapshot.anomaly());
        log.info("[Rules] default cooldown updated -> {}", cooldown);
    }

    public synchronized void updateAnomaly(AnomalySettings settings) {
        snapshot = new RuleSnapshot(snapshot.rules(), snapshot.defaultRule(), settings);
        log.info("[Rules] anomaly settings updated -> {}", settings);
    }
}
