package org.caureq.caureqsensorhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Boot-time settings under the {@code app} prefix.
 * Every nested block is optional; missing values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "app")
public record AppProps(IngestProps ingest, PipelineProps pipeline, AnomalyProps anomaly,
                       RulesProps rules, MqttProps mqtt, NotifyProps notifier) {

    public AppProps {
        if (ingest == null) ingest = new IngestProps(null);
        if (pipeline == null) pipeline = new PipelineProps(null, null, null, null, null, null);
        if (anomaly == null) anomaly = new AnomalyProps(null, null, null);
        if (rules == null) rules = new RulesProps(null, null);
        if (mqtt == null) mqtt = new MqttProps(false, null, null, null, null, null, null, null);
        if (notifier == null) notifier = new NotifyProps(null, null, null, null, null);
    }

    /** Gateway validation: how far in the future a reading timestamp may be. */
    public record IngestProps(Duration maxClockSkew) {
        public IngestProps {
            if (maxClockSkew == null) maxClockSkew = Duration.ofMinutes(5);
        }
    }

    /** Worker pool, admission and persistence retry settings of the processing core. */
    public record PipelineProps(Integer workers, Integer capacity, Integer maxAttempts,
                                Duration initialBackoff, Duration drainTimeout, Integer deadLetterCapacity) {
        public PipelineProps {
            if (workers == null || workers <= 0) workers = Math.max(2, Runtime.getRuntime().availableProcessors());
            if (capacity == null || capacity <= 0) capacity = 10_000;
            if (maxAttempts == null || maxAttempts <= 0) maxAttempts = 4;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(50);
            if (drainTimeout == null) drainTimeout = Duration.ofSeconds(30);
            if (deadLetterCapacity == null || deadLetterCapacity <= 0) deadLetterCapacity = 1_000;
        }
    }

    /** Boot values of the anomaly model; runtime changes go through the rule store. */
    public record AnomalyProps(Double scoreThreshold, Integer minSamples, Integer windowSize) {
        public AnomalyProps {
            if (scoreThreshold == null) scoreThreshold = 3.0;
            if (minSamples == null || minSamples < 1) minSamples = 5;
            if (windowSize == null || windowSize < 2) windowSize = 50;
        }
    }

    /** Threshold rules keyed by sensor type code (temperature, humidity, ...). */
    public record RulesProps(Duration defaultCooldown, Map<String, RuleProps> byType) {
        public RulesProps {
            if (defaultCooldown == null) defaultCooldown = Duration.ofHours(1);
            if (byType == null) byType = Map.of();
        }
    }

    public record RuleProps(Double min, Double max, Duration cooldown) {}

    /** Subscription adapter (MQTT). */
    public record MqttProps(boolean enabled, String brokerUri, String clientId, String topic, Integer qos,
                            Duration reconnectMin, Duration reconnectMax, Integer queueCapacity) {
        public MqttProps {
            if (brokerUri == null || brokerUri.isBlank()) brokerUri = "tcp://localhost:1883";
            if (clientId == null || clientId.isBlank()) clientId = "iot_dashboard_client";
            if (topic == null || topic.isBlank()) topic = "sensors/#";
            if (qos == null || qos < 0 || qos > 2) qos = 1;
            if (reconnectMin == null) reconnectMin = Duration.ofSeconds(1);
            if (reconnectMax == null) reconnectMax = Duration.ofMinutes(1);
            if (queueCapacity == null || queueCapacity <= 0) queueCapacity = 1_000;
        }
    }

    /** Outbound notification sinks; a sink is enabled when its target is configured. */
    public record NotifyProps(String webhookUrl, String telegramToken, String telegramChatId,
                              Duration timeout, Integer queueCapacity) {
        public NotifyProps {
            if (timeout == null) timeout = Duration.ofSeconds(10);
            if (queueCapacity == null || queueCapacity <= 0) queueCapacity = 500;
        }
    }
}
