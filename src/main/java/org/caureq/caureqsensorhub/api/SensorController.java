package org.caureq.caureqsensorhub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.api.dto.ReadingDTO;
import org.caureq.caureqsensorhub.api.dto.SensorDTO;
import org.caureq.caureqsensorhub.api.error.SensorNotFoundException;
import org.caureq.caureqsensorhub.service.SensorRegistry;
import org.caureq.caureqsensorhub.store.StorageAdapter;
import org.caureq.caureqsensorhub.store.TimeRange;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Sensors and their reading history.
 * Readings come back in arrival order; {@code limit} keeps the most recent ones.
 */
@RestController
@RequestMapping("/api/sensors")
@RequiredArgsConstructor
public class SensorController {
    static final int MAX_LIMIT = 10_000;

    private final SensorRegistry sensors;
    private final StorageAdapter storage;

    @GetMapping
    public List<SensorDTO> list() {
        return sensors.list().stream().map(SensorDTO::of).toList();
    }

    @GetMapping("/{id}")
    public SensorDTO one(@PathVariable String id) {
        return sensors.find(id).map(SensorDTO::of).orElseThrow(() -> new SensorNotFoundException(id));
    }

    @GetMapping("/{id}/readings")
    public List<ReadingDTO> readings(
            @PathVariable String id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        if (sensors.find(id).isEmpty()) throw new SensorNotFoundException(id);
        int lim = (limit == null ? 100 : Math.min(Math.max(limit, 1), MAX_LIMIT));
        return storage.getReadings(id, new TimeRange(from, to), lim).stream().map(ReadingDTO::of).toList();
    }
}
