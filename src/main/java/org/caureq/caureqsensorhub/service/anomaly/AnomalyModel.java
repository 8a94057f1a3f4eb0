package org.caureq.caureqsensorhub.service.anomaly;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.service.rules.RuleStore;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-sensor statistical model. Each sensor is scored only against its own history,
 * using the profile as it was before the new value; the value is folded in afterwards.
 * Profiles are partitioned by sensor id and owned exclusively by this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyModel {
    private final RuleStore ruleStore;
    private final Map<String, AnomalyProfile> profiles = new ConcurrentHashMap<>();

    public AnomalyScore scoreAndUpdate(String sensorId, double value) {
        var settings = ruleStore.anomaly();
        var profile = profiles.computeIfAbsent(sensorId, k -> new AnomalyProfile());
        var score = profile.score(value, settings.minSamples());
        profile.add(value, settings.windowSize());
        if (score.sufficient()) {
            log.debug("score {} value={} sigma={}", sensorId, value, score.value());
        }
        return score;
    }

    public Optional<ProfileStats> stats(String sensorId) {
        return Optional.ofNullable(profiles.get(sensorId)).map(p -> p.stats(sensorId));
    }
}
