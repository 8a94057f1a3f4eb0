package org.caureq.caureqsensorhub.service.rules;

import org.caureq.caureqsensorhub.domain.SensorType;

import java.util.Map;

/** Immutable view of the whole alerting configuration at one point in time. */
public record RuleSnapshot(Map<SensorType, AlertRule> rules, AlertRule defaultRule, AnomalySettings anomaly) {
    public RuleSnapshot {
        rules = Map.copyOf(rules);
    }

    public AlertRule ruleFor(SensorType type) {
        return rules.getOrDefault(type, defaultRule);
    }
}
