package org.caureq.caureqsensorhub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.api.dto.AlertDTO;
import org.caureq.caureqsensorhub.service.alerts.AlertQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Alerts: list, filter and acknowledge.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertQueryService alerts;

    @GetMapping
    public List<AlertDTO> list(
            @RequestParam(value = "sensorId", required = false) String sensorId,
            @RequestParam(value = "ack", required = false) Boolean ack,
            @RequestParam(value = "hours", required = false) Integer hours,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int h = (hours == null ? 24 : hours);
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        return alerts.recent(sensorId, ack, h, lim, off).stream().map(AlertDTO::of).toList();
    }

    @PostMapping("/{id}/ack")
    public AlertDTO ack(@PathVariable String id) {
        return AlertDTO.of(alerts.acknowledge(id));
    }
}
