package org.caureq.caureqsensorhub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqsensorhub.api.error.SensorNotFoundException;
import org.caureq.caureqsensorhub.service.anomaly.AnomalyModel;
import org.caureq.caureqsensorhub.service.anomaly.ProfileStats;
import org.caureq.caureqsensorhub.service.notify.NotifierDispatcher;
import org.caureq.caureqsensorhub.service.pipeline.DeadLetter;
import org.caureq.caureqsensorhub.service.pipeline.DeadLetterLog;
import org.caureq.caureqsensorhub.service.pipeline.PipelineStats;
import org.caureq.caureqsensorhub.service.pipeline.ProcessingCore;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Operational view of the pipeline: counters, dead letters and per-sensor profiles. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminPipelineController {
    private final ProcessingCore core;
    private final DeadLetterLog deadLetters;
    private final NotifierDispatcher notifier;
    private final AnomalyModel anomalyModel;

    public record NotifyStats(long delivered, long failed, long dropped) {}

    public record PipelineView(PipelineStats stats, NotifyStats notifier, List<DeadLetter> deadLetters) {}

    @GetMapping("/pipeline")
    public PipelineView pipeline() {
        return new PipelineView(core.stats(),
                new NotifyStats(notifier.delivered(), notifier.failed(), notifier.dropped()),
                deadLetters.entries());
    }

    @GetMapping("/profiles/{sensorId}")
    public ProfileStats profile(@PathVariable String sensorId) {
        return anomalyModel.stats(sensorId).orElseThrow(() -> new SensorNotFoundException(sensorId));
    }
}
