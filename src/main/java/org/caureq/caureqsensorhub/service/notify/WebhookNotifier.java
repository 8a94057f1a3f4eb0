package org.caureq.caureqsensorhub.service.notify;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.config.AppProps;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/** POSTs each alert as JSON to {@code app.notify.webhook-url}. */
@Component
@ConditionalOnProperty(prefix = "app.notify", name = "webhook-url")
@RequiredArgsConstructor
public class WebhookNotifier implements AlertNotifier {
    private final AppProps props;
    private final WebClient notifyWebClient;

    @Override
    public String name() { return "webhook"; }

    @Override
    public void send(AlertNotification n) {
        var url = props.notifier().webhookUrl();
        try {
            notifyWebClient.post().uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(n))
                    .retrieve()
                    .toBodilessEntity()
                    .retryWhen(HttpDelivery.RETRY)
                    .timeout(props.notifier().timeout())
                    .block();
        } catch (RuntimeException e) {
            throw new NotificationException("webhook delivery failed for alert " + n.alert().getId(), e);
        }
    }

    static Map<String, Object> payload(AlertNotification n) {
        var a = n.alert();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", a.getId());
        body.put("kind", a.getKind().name());
        body.put("sensorId", a.getSensorId());
        body.put("sensorType", n.sensor().getType().code());
        body.put("location", n.sensor().getLocation());
        body.put("readingId", a.getReadingId());
        body.put("ts", a.getTs().toString());
        body.put("value", a.getValueAtTrigger());
        body.put("unit", n.reading().getUnit());
        body.put("threshold", a.getThreshold());
        body.put("message", a.getMessage());
        return body;
    }
}
