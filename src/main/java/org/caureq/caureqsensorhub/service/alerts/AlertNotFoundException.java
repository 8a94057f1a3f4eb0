package org.caureq.caureqsensorhub.service.alerts;

public class AlertNotFoundException extends RuntimeException {
    public AlertNotFoundException(String id) {
        super("alert not found: " + id);
    }
}
