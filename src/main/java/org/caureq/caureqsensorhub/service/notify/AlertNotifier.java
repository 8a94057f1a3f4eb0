package org.caureq.caureqsensorhub.service.notify;

/** One outbound delivery channel. Implementations may block; they run on the dispatcher's own threads. */
public interface AlertNotifier {
    String name();

    void send(AlertNotification notification);
}
