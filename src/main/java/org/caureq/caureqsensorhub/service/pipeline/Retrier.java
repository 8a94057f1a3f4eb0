package org.caureq.caureqsensorhub.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.store.PermanentStorageException;
import org.caureq.caureqsensorhub.store.TransientStorageException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff (initial, x2, x4 ...) for transient storage failures.
 * A {@link PermanentStorageException} gives up at once; other exceptions are not caught.
 */
@Slf4j
final class Retrier {
    private final int maxAttempts;
    private final Duration initialBackoff;

    Retrier(int maxAttempts, Duration initialBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    <T> T call(String what, Supplier<T> action) {
        long backoff = initialBackoff.toMillis();
        TransientStorageException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientStorageException e) {
                last = e;
                if (attempt == maxAttempts) break;
                log.warn("[Pipeline] {} attempt {}/{} failed, retrying in {}ms: {}",
                        what, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetriesExhaustedException(what, attempt, e);
                }
                backoff = Math.min(backoff * 2, 30_000);
            } catch (PermanentStorageException e) {
                throw new RetriesExhaustedException(what, attempt, e);
            }
        }
        throw new RetriesExhaustedException(what, maxAttempts, last);
    }
}
