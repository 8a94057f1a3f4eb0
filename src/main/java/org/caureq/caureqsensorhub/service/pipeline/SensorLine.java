package org.caureq.caureqsensorhub.service.pipeline;

import org.caureq.caureqsensorhub.domain.Reading;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * FIFO processing line of one sensor.
 *
 * At most one drain task per line is ever scheduled on the shared pool, so readings
 * of a sensor are handled one at a time in enqueue order while other lines run in
 * parallel. A drain hands the worker back after a batch so busy sensors cannot starve quiet ones.
 */
final class SensorLine {
    private static final int BATCH = 64;

    private final Queue<Reading> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private final Executor executor;
    private final Consumer<Reading> handler;

    SensorLine(Executor executor, Consumer<Reading> handler) {
        this.executor = executor;
        this.handler = handler;
    }

    void enqueue(Reading reading) {
        queue.add(reading);
        try {
            schedule();
        } catch (RejectedExecutionException e) {
            queue.remove(reading);
            throw e;
        }
    }

    private void schedule() {
        if (scheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                throw e;
            }
        }
    }

    private void drain() {
        try {
            Reading next;
            int n = 0;
            while (n++ < BATCH && (next = queue.poll()) != null) {
                handler.accept(next);
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty()) schedule();
        }
    }
}
