package org.caureq.caureqsensorhub.mqtt;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.config.AppProps;
import org.caureq.caureqsensorhub.service.ingest.IngestGateway;
import org.caureq.caureqsensorhub.service.ingest.MalformedPayloadException;
import org.caureq.caureqsensorhub.service.ingest.ReadingDecoder;
import org.eclipse.paho.client.mqttv3.*;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscription adapter: keeps a session to the broker and feeds every message on
 * {@code app.mqtt.topic} to the ingest gateway.
 *
 * A connector thread (re)connects with exponential backoff between {@code reconnect-min} and
 * {@code reconnect-max}. Messages land in a bounded inbox; when it is full the Paho callback
 * thread blocks, which in turn holds back the broker. A single dispatcher thread drains the inbox
 * so that readings of a sensor reach the gateway in arrival order.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.mqtt", name = "enabled", havingValue = "true")
public class MqttSubscriber implements MqttCallback {
    private static final Message POISON = new Message(null, null);

    private final ReadingDecoder decoder;
    private final IngestGateway gateway;
    private final AppProps.MqttProps props;
    private final BlockingQueue<Message> inbox;
    private final Semaphore reconnectSignal = new Semaphore(0);

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private volatile boolean running;
    private MqttClient client;
    private Thread connector;
    private Thread dispatcher;

    record Message(String topic, byte[] payload) {}

    public MqttSubscriber(ReadingDecoder decoder, IngestGateway gateway, AppProps props) {
        this.decoder = decoder;
        this.gateway = gateway;
        this.props = props.mqtt();
        this.inbox = new ArrayBlockingQueue<>(this.props.queueCapacity());
    }

    /** A client that cannot be built leaves the subscription off; REST ingestion keeps running. */
    @PostConstruct
    public void start() {
        try {
            client = new MqttClient(props.brokerUri(), props.clientId(), new MemoryPersistence());
        } catch (MqttException | IllegalArgumentException e) {
            log.error("[Mqtt] cannot create client for {}, subscription disabled", props.brokerUri(), e);
            return;
        }
        client.setCallback(this);
        running = true;

        dispatcher = new Thread(this::dispatchLoop, "mqtt-dispatch");
        dispatcher.setDaemon(true);
        dispatcher.start();

        connector = new Thread(this::connectLoop, "mqtt-connect");
        connector.setDaemon(true);
        connector.start();
        log.info("[Mqtt] subscriber started broker={} topic={}", props.brokerUri(), props.topic());
    }

    private void connectLoop() {
        var backoff = props.reconnectMin();
        while (running) {
            if (!client.isConnected()) {
                try {
                    var opts = new MqttConnectOptions();
                    opts.setCleanSession(true);
                    opts.setAutomaticReconnect(false);
                    client.connect(opts);
                    client.subscribe(props.topic(), props.qos());
                    log.info("[Mqtt] connected to {} and subscribed to {}", props.brokerUri(), props.topic());
                    backoff = props.reconnectMin();
                } catch (MqttException e) {
                    log.warn("[Mqtt] connect to {} failed ({}), retrying in {}", props.brokerUri(), e.getMessage(), backoff);
                    if (!pause(backoff)) return;
                    backoff = next(backoff);
                    continue;
                }
            }
            // wait for connectionLost or shutdown
            try {
                reconnectSignal.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private Duration next(Duration backoff) {
        var doubled = backoff.multipliedBy(2);
        return doubled.compareTo(props.reconnectMax()) > 0 ? props.reconnectMax() : doubled;
    }

    private boolean pause(Duration d) {
        try {
            // a shutdown releases the signal and cuts the wait short
            reconnectSignal.tryAcquire(d.toMillis(), TimeUnit.MILLISECONDS);
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void dispatchLoop() {
        while (true) {
            Message m;
            try {
                m = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (m == POISON) return;
            try {
                handle(m.topic(), m.payload());
            } catch (RuntimeException e) {
                log.error("[Mqtt] unexpected failure handling message on {}", m.topic(), e);
            }
        }
    }

    /** Decodes and submits one message; rejections are logged and counted, never retried. */
    void handle(String topic, byte[] payload) {
        received.incrementAndGet();
        try {
            var result = gateway.submit(decoder.decode(topic, payload));
            if (!result.isAccepted()) {
                rejected.incrementAndGet();
                log.warn("[Mqtt] rejected message on {}: {} {}", topic, result.reason(), result.detail());
            }
        } catch (MalformedPayloadException e) {
            rejected.incrementAndGet();
            log.warn("[Mqtt] malformed message on {}: {}", topic, e.getMessage());
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("[Mqtt] connection lost: {}", cause == null ? "unknown" : cause.getMessage());
        reconnectSignal.release();
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) throws InterruptedException {
        inbox.put(new Message(topic, message.getPayload()));
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // subscribe-only client
    }

    public long received() { return received.get(); }
    public long rejected() { return rejected.get(); }
    public boolean active() { return running; }

    /** Disconnects first so no new message arrives, then lets the dispatcher empty the inbox. */
    @PreDestroy
    public void stop() throws InterruptedException {
        if (client == null) return;
        running = false;
        reconnectSignal.release();
        try {
            if (client.isConnected()) client.disconnect(5_000);
        } catch (MqttException e) {
            log.warn("[Mqtt] disconnect failed: {}", e.getMessage());
        }
        connector.join(5_000);
        inbox.put(POISON);
        dispatcher.join(30_000);
        try {
            client.close();
        } catch (MqttException e) {
            log.warn("[Mqtt] close failed: {}", e.getMessage());
        }
        log.info("[Mqtt] subscriber stopped, received={} rejected={}", received.get(), rejected.get());
    }
}
