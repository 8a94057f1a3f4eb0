package org.caureq.caureqsensorhub.store;

import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;

import java.util.List;
import java.util.Optional;

/**
 * Durable append and range-query surface over sensors, readings and alerts.
 *
 * Contract
 * - A reading returned by {@link #insertReading} is visible to every later {@link #getReadings} call.
 * - Inserts for one sensor are serialized; inserts for different sensors never wait on each other.
 * - Write failures that may succeed on retry surface as {@link TransientStorageException}.
 */
public interface StorageAdapter {

    /** Appends a reading and returns it with its store-assigned id. */
    Reading insertReading(Reading reading);

    /** Appends an alert and returns the stored copy. */
    AlertRecord insertAlert(AlertRecord alert);

    /** Registers the sensor unless its id is already known; returns the stored sensor either way. */
    Sensor registerSensor(Sensor sensor);

    Optional<Sensor> findSensor(String sensorId);

    /** Readings of one sensor inside the range, in arrival order; keeps the newest {@code limit}. */
    List<Reading> getReadings(String sensorId, TimeRange range, int limit);

    /** All known sensors ordered by id. */
    List<Sensor> listSensors();

    /** Alerts matching the filter, newest first. */
    List<AlertRecord> getAlerts(AlertFilter filter);

    Optional<AlertRecord> findAlert(String alertId);

    /**
     * Marks the alert acknowledged. Acknowledging an already acknowledged alert is a no-op.
     *
     * @return false when no alert has this id
     */
    boolean acknowledgeAlert(String alertId);
}
