package org.caureq.caureqsensorhub.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LogNotifier implements AlertNotifier {
    @Override
    public String name() { return "log"; }

    @Override
    public void send(AlertNotification n) {
        log.warn("ALERT {}: {} [sensor={} value={} ts={}]", n.alert().getKind(), n.alert().getMessage(),
                n.sensor().getId(), n.alert().getValueAtTrigger(), n.alert().getTs());
    }
}
