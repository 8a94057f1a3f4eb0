package org.caureq.caureqsensorhub.service.notify;

import org.caureq.caureqsensorhub.config.AppProps;
import org.caureq.caureqsensorhub.domain.AlertKind;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.domain.SensorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.caureq.caureqsensorhub.TestFixtures.*;

class NotifierDispatcherTest {

    private NotifierDispatcher dispatcher;

    private static AlertNotification notification() {
        var alert = AlertRecord.builder().id("a-1").sensorId("temperature_lab").kind(AlertKind.BELOW_MIN)
                .ts(T0).valueAtTrigger(5).threshold(10.0)
                .message("Low temperature alert: 5.00°C is below threshold of 10.00°C").build();
        return new AlertNotification(alert, sensor("temperature_lab", SensorType.TEMPERATURE),
                reading("temperature_lab", T0, 5));
    }

    private static AlertNotifier notifier(String name, List<String> seen, boolean fail) {
        return new AlertNotifier() {
            @Override
            public String name() { return name; }

            @Override
            public void send(AlertNotification n) {
                if (fail) throw new NotificationException(name + " is down");
                seen.add(name + ":" + n.alert().getId());
            }
        };
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (dispatcher != null) dispatcher.shutdown();
    }

    @Test
    void failingSinkDoesNotStopTheOthers() {
        List<String> seen = new CopyOnWriteArrayList<>();
        dispatcher = new NotifierDispatcher(List.of(
                notifier("broken", seen, true),
                notifier("log", seen, false)), props());

        dispatcher.dispatch(notification());

        await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.delivered() + dispatcher.failed() == 2);
        assertThat(seen).containsExactly("log:a-1");
        assertThat(dispatcher.failed()).isEqualTo(1);
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws InterruptedException {
        var release = new CountDownLatch(1);
        AlertNotifier slow = new AlertNotifier() {
            @Override
            public String name() { return "slow"; }

            @Override
            public void send(AlertNotification n) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        var small = new AppProps(null, null, null, null, null, new AppProps.NotifyProps(null, null, null, null, 1));
        dispatcher = new NotifierDispatcher(List.of(slow), small);

        // two running, one queued, the rest dropped
        for (int i = 0; i < 10; i++) dispatcher.dispatch(notification());

        assertThat(dispatcher.dropped()).isEqualTo(7);
        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.delivered() == 3);
    }

    @Test
    void telegramTextFollowsTheAlertLayout() {
        assertThat(TelegramNotifier.text(notification())).isEqualTo(
                "ALERT: Low temperature alert: 5.00°C is below threshold of 10.00°C\n"
                        + "Sensor: temperature_lab\nTime: 2024-03-01T12:00:00Z\nValue: 5.0");
    }

    @Test
    void webhookPayloadCarriesTheAlert() {
        var body = WebhookNotifier.payload(notification());

        assertThat(body).containsEntry("kind", "BELOW_MIN")
                .containsEntry("sensorType", "temperature")
                .containsEntry("value", 5.0)
                .containsEntry("threshold", 10.0);
    }
}
