package org.caureq.caureqsensorhub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.caureq.caureqsensorhub.store.StorageAdapter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known sensors, cached in front of the store. Sensors are created on first sight
 * and never changed afterwards, so a cached entry never goes stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensorRegistry {
    private final StorageAdapter storage;
    private final Map<String, Sensor> cache = new ConcurrentHashMap<>();

    public Optional<Sensor> find(String sensorId) {
        var cached = cache.get(sensorId);
        if (cached != null) return Optional.of(cached);
        var stored = storage.findSensor(sensorId);
        stored.ifPresent(s -> cache.putIfAbsent(s.getId(), s));
        return stored;
    }

    /** Returns the known sensor, registering it first if the id has never been seen. */
    public Sensor resolveOrRegister(String sensorId, SensorType type, String name, String location) {
        var known = find(sensorId);
        if (known.isPresent()) return known.get();
        var stored = storage.registerSensor(Sensor.builder()
                .id(sensorId)
                .type(type)
                .name(name == null || name.isBlank() ? sensorId : name.trim())
                .location(location == null || location.isBlank() ? "unknown" : location.trim())
                .build());
        var prev = cache.putIfAbsent(stored.getId(), stored);
        if (prev == null) log.info("[Sensors] registered {} type={} location={}", stored.getId(),
                stored.getType().code(), stored.getLocation());
        return prev != null ? prev : stored;
    }

    public List<Sensor> list() {
        return storage.listSensors();
    }
}
