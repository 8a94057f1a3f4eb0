package org.caureq.caureqsensorhub.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqsensorhub.domain.AlertRecord;
import org.caureq.caureqsensorhub.store.AlertFilter;
import org.caureq.caureqsensorhub.store.StorageAdapter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Read side of alerts plus acknowledgement, the one mutation allowed from outside the core. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertQueryService {
    private final StorageAdapter storage;
    private final Clock clock;

    /** Alerts from the last {@code hours} hours, newest first, with optional filters and pagination. */
    public List<AlertRecord> recent(String sensorId, Boolean acknowledged, int hours, int limit, int offset) {
        var since = clock.instant().minus(Duration.ofHours(Math.max(1, hours)));
        return storage.getAlerts(new AlertFilter(sensorId, acknowledged, since, limit, offset));
    }

    /** Idempotent: acknowledging twice succeeds both times and leaves the alert acknowledged. */
    public AlertRecord acknowledge(String id) {
        if (!storage.acknowledgeAlert(id)) throw new AlertNotFoundException(id);
        log.info("[Alerts] acknowledged {}", id);
        return storage.findAlert(id).orElseThrow(() -> new AlertNotFoundException(id));
    }
}
