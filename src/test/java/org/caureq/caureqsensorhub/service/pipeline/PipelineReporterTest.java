package org.caureq.caureqsensorhub.service.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineReporterTest {

    @Mock
    private ProcessingCore core;

    @InjectMocks
    private PipelineReporter reporter;

    @Test
    void readsStatsOnEveryTick() {
        when(core.stats()).thenReturn(new PipelineStats(3, 3, 3, 0, 1, 0, 1, true));

        reporter.report();
        reporter.report();

        verify(core, times(2)).stats();
    }
}
