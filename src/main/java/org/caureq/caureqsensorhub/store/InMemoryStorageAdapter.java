package org.caureq.caureqsensorhub.store;

import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for the {@code memory} profile and for tests.
 * Each sensor owns its own append-only list, so sensors never contend with each other.
 */
@Component
@Profile("memory")
public class InMemoryStorageAdapter implements StorageAdapter {
    private final Map<String, Sensor> sensors = new ConcurrentHashMap<>();
    private final Map<String, List<Reading>> readings = new ConcurrentHashMap<>();
    private final Map<String, AlertRecord> alerts = new ConcurrentHashMap<>();
    private final AtomicLong readingSeq = new AtomicLong();
    private final Clock clock;

    public InMemoryStorageAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Reading insertReading(Reading reading) {
        var series = readings.computeIfAbsent(reading.getSensorId(), k -> new ArrayList<>());
        synchronized (series) {
            var stored = reading.toBuilder().id(readingSeq.incrementAndGet()).build();
            series.add(stored);
            return stored;
        }
    }

    @Override
    public AlertRecord insertAlert(AlertRecord alert) {
        var stored = alert.toBuilder()
                .id(alert.getId() == null ? UUID.randomUUID().toString() : alert.getId())
                .ts(alert.getTs() == null ? clock.instant() : alert.getTs())
                .build();
        alerts.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Sensor registerSensor(Sensor sensor) {
        return sensors.computeIfAbsent(sensor.getId(), k -> sensor.getCreatedAt() != null ? sensor :
                Sensor.builder().id(sensor.getId()).type(sensor.getType()).name(sensor.getName())
                        .location(sensor.getLocation()).createdAt(clock.instant()).build());
    }

    @Override
    public Optional<Sensor> findSensor(String sensorId) {
        return Optional.ofNullable(sensors.get(sensorId));
    }

    @Override
    public List<Reading> getReadings(String sensorId, TimeRange range, int limit) {
        var series = readings.get(sensorId);
        if (series == null) return List.of();
        List<Reading> matching;
        synchronized (series) {
            matching = series.stream().filter(r -> range.contains(r.getTs())).toList();
        }
        int keep = Math.max(1, limit);
        return matching.size() <= keep ? matching : matching.subList(matching.size() - keep, matching.size());
    }

    @Override
    public List<Sensor> listSensors() {
        return sensors.values().stream().sorted(Comparator.comparing(Sensor::getId)).toList();
    }

    @Override
    public List<AlertRecord> getAlerts(AlertFilter f) {
        return alerts.values().stream()
                .filter(a -> f.sensorId() == null || f.sensorId().equals(a.getSensorId()))
                .filter(a -> f.acknowledged() == null || f.acknowledged() == a.isAcknowledged())
                .filter(a -> !a.getTs().isBefore(f.since()))
                .sorted(Comparator.comparing(AlertRecord::getTs).reversed())
                .skip(f.offset())
                .limit(f.limit())
                .toList();
    }

    @Override
    public Optional<AlertRecord> findAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public boolean acknowledgeAlert(String alertId) {
        var updated = alerts.computeIfPresent(alertId, (id, a) ->
                a.isAcknowledged() ? a : a.toBuilder().acknowledged(true).build());
        return updated != null;
    }
}
