package org.caureq.caureqsensorhub.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.api.dto.AnomalyDTO;
import org.caureq.caureqsensorhub.api.dto.RuleDTO;
import org.caureq.caureqsensorhub.api.dto.RulesConfigDTO;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.service.rules.AlertRule;
import org.caureq.caureqsensorhub.service.rules.RuleStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;

/** Admin endpoints to view/update alert rules and anomaly settings at runtime. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminRulesController {
    private final RuleStore rules;

    @GetMapping("/rules")
    public RulesConfigDTO get() {
        var snap = rules.snapshot();
        var list = snap.rules().entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getKey().code()))
                .map(e -> RuleDTO.of(e.getKey(), e.getValue()))
                .toList();
        return new RulesConfigDTO(snap.defaultRule().cooldown().toSeconds(), list);
    }

    @PutMapping("/rules")
    public ResponseEntity<?> replace(@RequestBody @Valid RulesConfigDTO body) {
        var defaultCooldown = body.defaultCooldownSeconds() == null
                ? rules.snapshot().defaultRule().cooldown()
                : Duration.ofSeconds(body.defaultCooldownSeconds());
        var map = new EnumMap<SensorType, AlertRule>(SensorType.class);
        for (var r : body.rules()) {
            var type = type(r.type());
            if (map.put(type, r.toRule(defaultCooldown)) != null) {
                throw new IllegalArgumentException("duplicate rule for " + type.code());
            }
        }
        // validate everything before touching the store
        if (body.defaultCooldownSeconds() != null) rules.updateDefaultCooldown(defaultCooldown);
        rules.replaceRules(map);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/rules/{type}")
    public RuleDTO put(@PathVariable String type, @RequestBody @Valid RuleDTO body) {
        var t = type(type);
        if (!t.code().equals(type(body.type()).code())) {
            throw new IllegalArgumentException("path type " + type + " does not match body type " + body.type());
        }
        var rule = body.toRule(rules.snapshot().defaultRule().cooldown());
        rules.putRule(t, rule);
        return RuleDTO.of(t, rule);
    }

    @DeleteMapping("/rules/{type}")
    public ResponseEntity<?> delete(@PathVariable String type) {
        return rules.removeRule(type(type))
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/anomaly")
    public AnomalyDTO anomaly() {
        return AnomalyDTO.of(rules.anomaly());
    }

    @PutMapping("/anomaly")
    public AnomalyDTO updateAnomaly(@RequestBody @Valid AnomalyDTO body) {
        var settings = body.toSettings();
        rules.updateAnomaly(settings);
        return AnomalyDTO.of(settings);
    }

    private static SensorType type(String raw) {
        return SensorType.resolve(raw).orElseThrow(() -> new IllegalArgumentException("unknown sensor type: " + raw));
    }
}
