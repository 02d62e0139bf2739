package com.seismic.sentinel.monitor.service.pipeline;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.model.CycleReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineRefreshJob {

    private final PipelineOrchestrator orchestrator;
    private final MonitorProperties props;

    // fixed delay: the next tick is measured from the end of the previous cycle
    @Scheduled(fixedDelayString = "${monitor.poll-interval-seconds:60}",
            initialDelayString = "${monitor.initial-delay-seconds:0}",
            timeUnit = TimeUnit.SECONDS)
    public void run() {
        if (!props.isEnabled()) return;
        Result<CycleReport> r = orchestrator.triggerCycle();
        if (!r.isOk()) {
            log.info("Scheduled refresh skipped: {} ({})", r.getErrorCode(), r.getError());
        }
    }
}
