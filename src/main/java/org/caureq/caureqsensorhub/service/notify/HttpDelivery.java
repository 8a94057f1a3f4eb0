package org.caureq.caureqsensorhub.service.notify;

import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/** Retry policy shared by the HTTP notifiers: one quick retry on I/O errors, none on HTTP status errors. */
final class HttpDelivery {
    static final Retry RETRY = Retry.backoff(1, Duration.ofMillis(400)).jitter(0.4)
            .filter(ex -> ex instanceof IOException || ex instanceof TimeoutException);

    private HttpDelivery() {}
}
