package com.seismic.sentinel.monitor.test.web;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.common.exception.GlobalExceptionHandler;
import com.seismic.sentinel.monitor.common.exception.ProcessingException;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.model.Snapshot;
import com.seismic.sentinel.monitor.service.export.EventCsvExporter;
import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import com.seismic.sentinel.monitor.web.PipelineController;
import com.seismic.sentinel.monitor.web.SnapshotController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PipelineWebTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private PipelineOrchestrator orchestrator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        mvc = MockMvcBuilders
                .standaloneSetup(new SnapshotController(orchestrator, new EventCsvExporter()),
                        new PipelineController(orchestrator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void snapshotBeforeFirstPublishIs503() throws Exception {
        when(orchestrator.getSnapshot()).thenReturn(Result.fail("SNAPSHOT_UNAVAILABLE", "No cycle has been published yet"));

        mvc.perform(get("/api/snapshot"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SNAPSHOT_UNAVAILABLE"));
    }

    @Test
    void recommendationsComeFromTheSnapshot() throws Exception {
        when(orchestrator.getSnapshot()).thenReturn(Result.ok(snapshot()));

        mvc.perform(get("/api/snapshot/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].ruleName").value("elevated-risk-cluster"))
                .andExpect(jsonPath("$[0].severity").value("HIGH"));
    }

    @Test
    void eventsCsvIsAnAttachment() throws Exception {
        when(orchestrator.getSnapshot()).thenReturn(Result.ok(snapshot()));

        mvc.perform(get("/api/snapshot/events.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("events-7.csv")))
                .andExpect(content().string(containsString("A,2024-05-01T12:00:00Z")));
    }

    @Test
    void refreshDuringRunningCycleIs409() throws Exception {
        when(orchestrator.triggerCycle()).thenReturn(Result.fail("CYCLE_IN_PROGRESS", "A refresh cycle is already running"));

        mvc.perform(post("/api/pipeline/refresh"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CYCLE_IN_PROGRESS"));
    }

    @Test
    void clearStoreReturnsRemovedCount() throws Exception {
        when(orchestrator.clearStore()).thenReturn(Result.ok(3));

        mvc.perform(post("/api/pipeline/store/clear"))
                .andExpect(status().isOk())
                .andExpect(content().string("3"));
    }

    @Test
    void thrownMonitorExceptionIsMappedByErrorCode() throws Exception {
        when(orchestrator.getPipelineState()).thenThrow(new ProcessingException("store unavailable"));

        mvc.perform(get("/api/pipeline/state"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("ERR-PROC-001"));
    }

    private static Snapshot snapshot() {
        EventRecord a = EventRecord.builder()
                .id("A").observedAt(NOW).sourceUpdatedAt(NOW).lastSeenAt(NOW).magnitude(6.0).build();
        Recommendation r = Recommendation.builder()
                .ruleName("elevated-risk-cluster")
                .action("REVIEW_CLUSTER_ACTIVITY")
                .subjectIds(List.of("cluster:A"))
                .severity(Severity.HIGH)
                .rationale(List.of())
                .latestObservedAt(NOW)
                .generatedAt(NOW)
                .build();
        return Snapshot.builder()
                .events(List.of(a))
                .recommendations(List.of(r))
                .cycleTimestamp(NOW)
                .cycleSequenceNumber(7L)
                .build();
    }
}
