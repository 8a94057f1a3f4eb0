package org.caureq.caureqsensorhub.service.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic one-line pipeline summary; silent while nothing moves. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineReporter {
    private final ProcessingCore core;
    private long lastAccepted = -1;

    @Scheduled(fixedDelayString = "${app.pipeline.report-ms:60000}", initialDelayString = "${app.pipeline.report-ms:60000}")
    public void report() {
        var s = core.stats();
        if (s.accepted() == lastAccepted) return;
        lastAccepted = s.accepted();
        log.info("[Pipeline] accepted={} processed={} persisted={} deadLettered={} alerts={} inFlight={} lines={}",
                s.accepted(), s.processed(), s.persisted(), s.deadLettered(), s.alertsRaised(), s.inFlight(), s.lines());
    }
}
