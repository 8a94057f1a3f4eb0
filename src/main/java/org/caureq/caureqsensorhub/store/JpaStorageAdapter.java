package org.caureq.caureqsensorhub.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.repo.AlertRepo;
import org.caureq.caureqsensorhub.repo.ReadingRepo;
import org.caureq.caureqsensorhub.repo.SensorRepo;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * SQL-backed store (Spring Data JPA). Active unless the {@code memory} profile is on.
 */
@Slf4j
@Component
@Profile("!memory")
@RequiredArgsConstructor
public class JpaStorageAdapter implements StorageAdapter {
    private final SensorRepo sensorRepo;
    private final ReadingRepo readingRepo;
    private final AlertRepo alertRepo;
    private final SensorLocks locks = new SensorLocks();

    @Override
    public Reading insertReading(Reading reading) {
        return locks.withLock(reading.getSensorId(), () -> {
            try {
                return readingRepo.save(reading);
            } catch (DataIntegrityViolationException e) {
                throw new PermanentStorageException("reading rejected by the store for " + reading.getSensorId(), e);
            } catch (DataAccessException e) {
                throw new TransientStorageException("reading insert failed for " + reading.getSensorId(), e);
            }
        });
    }

    @Override
    public AlertRecord insertAlert(AlertRecord alert) {
        try {
            return alertRepo.save(alert);
        } catch (DataIntegrityViolationException e) {
            throw new PermanentStorageException("alert rejected by the store for " + alert.getSensorId(), e);
        } catch (DataAccessException e) {
            throw new TransientStorageException("alert insert failed for " + alert.getSensorId(), e);
        }
    }

    @Override
    public Sensor registerSensor(Sensor sensor) {
        return locks.withLock(sensor.getId(), () -> {
            try {
                return sensorRepo.findById(sensor.getId()).orElseGet(() -> sensorRepo.save(sensor));
            } catch (DataIntegrityViolationException e) {
                // registered by another process between find and save
                return sensorRepo.findById(sensor.getId()).orElseThrow(() ->
                        new TransientStorageException("sensor registration failed for " + sensor.getId(), e));
            } catch (DataAccessException e) {
                throw new TransientStorageException("sensor registration failed for " + sensor.getId(), e);
            }
        });
    }

    @Override
    public Optional<Sensor> findSensor(String sensorId) {
        return sensorRepo.findById(sensorId);
    }

    @Override
    public List<Reading> getReadings(String sensorId, TimeRange range, int limit) {
        var page = PageRequest.of(0, Math.max(1, limit));
        var newestFirst = readingRepo.findBySensorIdAndTsBetweenOrderByIdDesc(sensorId, range.from(), range.to(), page);
        var list = new ArrayList<>(newestFirst);
        Collections.reverse(list);
        return list;
    }

    @Override
    public List<Sensor> listSensors() {
        return sensorRepo.findAll(Sort.by("id").ascending());
    }

    /**
     * Skips exactly {@code offset} rows. An offset on a page boundary maps to that page;
     * otherwise the first {@code offset + limit} rows are fetched and the head is dropped.
     */
    @Override
    public List<AlertRecord> getAlerts(AlertFilter f) {
        boolean aligned = f.offset() % f.limit() == 0;
        Pageable p = aligned
                ? PageRequest.of(f.offset() / f.limit(), f.limit(), Sort.by(Sort.Direction.DESC, "ts"))
                : PageRequest.of(0, f.offset() + f.limit(), Sort.by(Sort.Direction.DESC, "ts"));
        var result = (
                f.sensorId() != null && f.acknowledged() != null ?
                        alertRepo.findBySensorIdAndAcknowledgedAndTsGreaterThanEqual(f.sensorId(), f.acknowledged(), f.since(), p) :
                f.sensorId() != null ?
                        alertRepo.findBySensorIdAndTsGreaterThanEqual(f.sensorId(), f.since(), p) :
                f.acknowledged() != null ?
                        alertRepo.findByAcknowledgedAndTsGreaterThanEqual(f.acknowledged(), f.since(), p) :
                        alertRepo.findByTsGreaterThanEqual(f.since(), p)
        ).getContent();
        if (aligned) return result;
        return result.size() <= f.offset() ? List.of() : result.subList(f.offset(), result.size());
    }

    @Override
    public Optional<AlertRecord> findAlert(String alertId) {
        return alertRepo.findById(alertId);
    }

    @Override
    @Transactional
    public boolean acknowledgeAlert(String alertId) {
        return alertRepo.findById(alertId).map(a -> {
            if (!a.isAcknowledged()) {
                a.setAcknowledged(true);
                alertRepo.save(a);
                log.debug("alert {} acknowledged", alertId);
            }
            return true;
        }).orElse(false);
    }
}
