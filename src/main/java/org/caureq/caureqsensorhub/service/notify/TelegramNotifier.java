package org.caureq.caureqsensorhub.service.notify;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.config.AppProps;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/** Sends alerts to a Telegram chat through the bot API {@code sendMessage} call. */
@Component
@ConditionalOnProperty(prefix = "app.notify", name = {"telegram-token", "telegram-chat-id"})
@RequiredArgsConstructor
public class TelegramNotifier implements AlertNotifier {
    private static final String API = "https://api.telegram.org";

    private final AppProps props;
    private final WebClient notifyWebClient;

    @Override
    public String name() { return "telegram"; }

    @Override
    public void send(AlertNotification n) {
        var cfg = props.notifier();
        try {
            notifyWebClient.post()
                    .uri(API + "/bot{token}/sendMessage", cfg.telegramToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("chat_id", cfg.telegramChatId(), "text", text(n)))
                    .retrieve()
                    .toBodilessEntity()
                    .retryWhen(HttpDelivery.RETRY)
                    .timeout(cfg.timeout())
                    .block();
        } catch (RuntimeException e) {
            throw new NotificationException("telegram delivery failed for alert " + n.alert().getId(), e);
        }
    }

    static String text(AlertNotification n) {
        var a = n.alert();
        return "ALERT: %s\nSensor: %s\nTime: %s\nValue: %s"
                .formatted(a.getMessage(), a.getSensorId(), a.getTs(), a.getValueAtTrigger());
    }
}
