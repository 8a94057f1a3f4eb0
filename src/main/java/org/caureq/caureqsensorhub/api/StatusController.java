package org.caureq.caureqsensorhub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.service.pipeline.PipelineStats;
import org.caureq.caureqsensorhub.service.pipeline.ProcessingCore;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

/** Liveness endpoint polled by dashboards. */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {
    private final ProcessingCore core;
    private final Clock clock;

    public record Status(String status, Instant timestamp, PipelineStats pipeline) {}

    @GetMapping
    public Status status() {
        var stats = core.stats();
        return new Status(stats.accepting() ? "online" : "draining", clock.instant(), stats);
    }
}
