package com.seismic.sentinel.monitor.test.pipeline;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import com.seismic.sentinel.monitor.service.pipeline.PipelineRefreshJob;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineRefreshJobTest {

    private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
    private final MonitorProperties props = new MonitorProperties();

    @Test
    void disabledMonitorSkipsTheTick() {
        props.setEnabled(false);

        new PipelineRefreshJob(orchestrator, props).run();

        verify(orchestrator, never()).triggerCycle();
    }

    @Test
    void enabledMonitorRunsACycleAndToleratesARejectedOne() {
        props.setEnabled(true);
        when(orchestrator.triggerCycle()).thenReturn(Result.fail("CYCLE_IN_PROGRESS", "A cycle is already running"));

        new PipelineRefreshJob(orchestrator, props).run();

        verify(orchestrator).triggerCycle();
    }
}
