package org.caureq.caureqsensorhub.service.notify;

/** Delivery to one sink failed. Logged by the dispatcher, never propagated to the pipeline. */
public class NotificationException extends RuntimeException {
    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
