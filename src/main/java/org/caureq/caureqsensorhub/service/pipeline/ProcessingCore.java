package org.caureq.caureqsensorhub.service.pipeline;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.Reading;
import org.caureq.caureqsensorhub.domain.Sensor;
import org.caureq.caureqsensorhub.service.SensorRegistry;
import org.caureq.caureqsensorhub.service.alerts.AlertEvaluator;
import org.caureq.caureqsensorhub.service.anomaly.AnomalyModel;
import org.caureq.caureqsensorhub.service.notify.AlertNotification;
import org.caureq.caureqsensorhub.service.notify.NotifierDispatcher;
import org.caureq.caureqsensorhub.store.StorageAdapter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central pipeline: orders readings per sensor, persists them, scores them, evaluates
 * alerts and hands raised alerts to the notifiers.
 *
 * Per reading, in this fixed order:
 * 1. persist (bounded retry with backoff, then dead-letter and carry on)
 * 2. anomaly score
 * 3. alert evaluation
 * 4. persist each raised alert, then dispatch it
 *
 * {@link #process} only enqueues. Admission is bounded by {@code app.pipeline.capacity}
 * readings in flight; when full, the submitter waits for a free slot.
 */
@Slf4j
@Service
public class ProcessingCore {
    private final StorageAdapter storage;
    private final SensorRegistry sensors;
    private final AnomalyModel anomalyModel;
    private final AlertEvaluator evaluator;
    private final NotifierDispatcher notifier;
    private final DeadLetterLog deadLetters;
    private final Clock clock;

    private final Retrier retrier;
    private final ExecutorService workers;
    private final Semaphore slots;
    private final int capacity;
    private final Duration drainTimeout;
    private final Map<String, SensorLine> lines = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();

    public ProcessingCore(StorageAdapter storage, SensorRegistry sensors, AnomalyModel anomalyModel,
                          AlertEvaluator evaluator, NotifierDispatcher notifier, DeadLetterLog deadLetters,
                          Clock clock, AppProps props) {
        this.storage = storage;
        this.sensors = sensors;
        this.anomalyModel = anomalyModel;
        this.evaluator = evaluator;
        this.notifier = notifier;
        this.deadLetters = deadLetters;
        this.clock = clock;

        var p = props.pipeline();
        this.retrier = new Retrier(p.maxAttempts(), p.initialBackoff());
        this.capacity = p.capacity();
        this.slots = new Semaphore(capacity);
        this.drainTimeout = p.drainTimeout();
        var seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(p.workers(), r -> {
            var t = new Thread(r, "pipeline-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[Pipeline] workers={} capacity={} maxAttempts={}", p.workers(), capacity, p.maxAttempts());
    }

    /**
     * Enqueues the reading on its sensor's line and returns.
     *
     * @throws PipelineUnavailableException when shutting down, or interrupted while waiting for a slot
     */
    public void process(Reading reading) {
        acquireSlot();
        try {
            lines.computeIfAbsent(reading.getSensorId(), id -> new SensorLine(workers, this::handle))
                    .enqueue(reading);
            accepted.incrementAndGet();
        } catch (RejectedExecutionException e) {
            slots.release();
            throw new PipelineUnavailableException("pipeline is shut down");
        }
    }

    private void acquireSlot() {
        try {
            while (!slots.tryAcquire(100, TimeUnit.MILLISECONDS)) {
                if (!accepting) throw new PipelineUnavailableException("pipeline is shutting down");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineUnavailableException("interrupted while waiting for pipeline capacity");
        }
        if (!accepting) {
            slots.release();
            throw new PipelineUnavailableException("pipeline is shutting down");
        }
    }

    private void handle(Reading reading) {
        try {
            var sensor = sensors.find(reading.getSensorId())
                    .orElseThrow(() -> new IllegalStateException("unregistered sensor " + reading.getSensorId()));
            var stored = persistReading(reading);
            var score = anomalyModel.scoreAndUpdate(sensor.getId(), stored.getValue());
            for (var alert : evaluator.evaluate(sensor, stored, score)) {
                raise(alert, sensor, stored);
            }
        } catch (RuntimeException e) {
            // a line must keep moving whatever one reading does
            log.error("[Pipeline] failed to process reading of {} at {}", reading.getSensorId(), reading.getTs(), e);
        } finally {
            processed.incrementAndGet();
            slots.release();
        }
    }

    private Reading persistReading(Reading reading) {
        try {
            var stored = retrier.call("insert reading " + reading.getSensorId(), () -> storage.insertReading(reading));
            persisted.incrementAndGet();
            return stored;
        } catch (RetriesExhaustedException e) {
            deadLetters.record(new DeadLetter(DeadLetter.Kind.READING, reading.getSensorId(), null, reading.getTs(),
                    reading.getValue(), e.attempts(), rootMessage(e), clock.instant()));
            return reading;
        }
    }

    private void raise(AlertRecord alert, Sensor sensor, Reading reading) {
        alertsRaised.incrementAndGet();
        AlertRecord stored;
        try {
            stored = retrier.call("insert alert " + alert.getSensorId(), () -> storage.insertAlert(alert));
        } catch (RetriesExhaustedException e) {
            deadLetters.record(new DeadLetter(DeadLetter.Kind.ALERT, alert.getSensorId(), alert.getId(), alert.getTs(),
                    alert.getValueAtTrigger(), e.attempts(), rootMessage(e), clock.instant()));
            stored = alert;
        }
        log.info("[Pipeline] {} alert for {} value={}", stored.getKind(), stored.getSensorId(), stored.getValueAtTrigger());
        notifier.dispatch(new AlertNotification(stored, sensor, reading));
    }

    private static String rootMessage(Throwable e) {
        var t = e;
        while (t.getCause() != null) t = t.getCause();
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    public PipelineStats stats() {
        return new PipelineStats(accepted.get(), processed.get(), persisted.get(), deadLetters.total(),
                alertsRaised.get(), capacity - slots.availablePermits(), lines.size(), accepting);
    }

    @PreDestroy
    void close() {
        shutdown();
    }

    /**
     * Stops taking new readings, lets every line finish what it already holds, then
     * releases the worker pool. Returns false if the drain timed out.
     */
    public boolean shutdown() {
        if (!accepting && workers.isShutdown()) return true;
        accepting = false;
        log.info("[Pipeline] shutting down, draining {} reading(s)", capacity - slots.availablePermits());
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        boolean drained = true;
        try {
            while (slots.availablePermits() < capacity) {
                if (System.nanoTime() > deadline) {
                    drained = false;
                    break;
                }
                Thread.sleep(10);
            }
            workers.shutdown();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            drained = false;
        }
        if (!drained) {
            log.warn("[Pipeline] drain timed out with {} reading(s) in flight", capacity - slots.availablePermits());
        } else {
            log.info("[Pipeline] drained, processed={}", processed.get());
        }
        return drained;
    }
}
