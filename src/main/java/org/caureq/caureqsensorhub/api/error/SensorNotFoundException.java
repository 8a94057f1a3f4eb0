package org.caureq.caureqsensorhub.api.error;

public class SensorNotFoundException extends RuntimeException {
    public SensorNotFoundException(String sensorId) {
        super("sensor not found: " + sensorId);
    }
}
