package org.caureq.caureqsensorhub.service.notify;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort, fire-and-forget delivery of raised alerts.
 *
 * Deliveries run on a small pool with a bounded queue. When the queue is full the
 * notification is dropped with a warning; a failing sink is logged and the other sinks
 * still run. Stored alert state stays authoritative whatever happens here.
 */
@Slf4j
@Service
public class NotifierDispatcher {
    private final List<AlertNotifier> notifiers;
    private final ThreadPoolExecutor executor;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public NotifierDispatcher(List<AlertNotifier> notifiers, AppProps props) {
        this.notifiers = List.copyOf(notifiers);
        var seq = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(1, 2, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(props.notifier().queueCapacity()),
                r -> {
                    var t = new Thread(r, "notify-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        log.info("[Notify] sinks={}", this.notifiers.stream().map(AlertNotifier::name).toList());
    }

    /** Never throws and never blocks the caller. */
    public void dispatch(AlertNotification notification) {
        try {
            executor.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            log.warn("[Notify] queue full or closed, dropped alert {}", notification.alert().getId());
        }
    }

    private void deliver(AlertNotification n) {
        for (var notifier : notifiers) {
            try {
                notifier.send(n);
                delivered.incrementAndGet();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                log.warn("[Notify] {} failed for alert {}: {}", notifier.name(), n.alert().getId(), e.getMessage());
            }
        }
    }

    public long delivered() { return delivered.get(); }
    public long failed() { return failed.get(); }
    public long dropped() { return dropped.get(); }

    @PreDestroy
    void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("[Notify] {} notification(s) abandoned at shutdown", executor.shutdownNow().size());
        }
    }
}
