package org.caureq.caureqsensorhub.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process record of failed writes, kept apart from the store that just failed.
 * Every entry is also logged at ERROR; the ring keeps the most recent entries only.
 */
@Slf4j
@Component
public class DeadLetterLog {
    private final int capacity;
    private final Deque<DeadLetter> entries = new ArrayDeque<>();
    private final AtomicLong total = new AtomicLong();

    public DeadLetterLog(AppProps props) {
        this.capacity = props.pipeline().deadLetterCapacity();
    }

    public void record(DeadLetter letter) {
        total.incrementAndGet();
        log.error("[Pipeline] dead-letter {} sensor={} ts={} value={} after {} attempt(s): {}",
                letter.kind(), letter.sensorId(), letter.eventTs(), letter.value(), letter.attempts(), letter.error());
        synchronized (entries) {
            if (entries.size() == capacity) entries.removeFirst();
            entries.addLast(letter);
        }
    }

    /** Oldest first. */
    public List<DeadLetter> entries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    public long total() { return total.get(); }
}
