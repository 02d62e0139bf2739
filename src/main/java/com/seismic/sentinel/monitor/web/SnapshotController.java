package com.seismic.sentinel.monitor.web;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.common.exception.Http;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.model.Snapshot;
import com.seismic.sentinel.monitor.service.export.EventCsvExporter;
import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/snapshot")
@RequiredArgsConstructor
public class SnapshotController {

    private final PipelineOrchestrator orchestrator;
    private final EventCsvExporter csvExporter;

    @GetMapping
    public ResponseEntity<?> snapshot() {
        return Http.from(orchestrator.getSnapshot());
    }

    @GetMapping("/recommendations")
    public ResponseEntity<?> recommendations() {
        Result<List<Recommendation>> r = orchestrator.getSnapshot().map(Snapshot::getRecommendations);
        return Http.from(r);
    }

    // download of the events held by the latest published snapshot
    @GetMapping("/events.csv")
    public ResponseEntity<?> eventsCsv() {
        Result<Snapshot> r = orchestrator.getSnapshot();
        if (!r.isOk()) return Http.from(r);

        String name = "events-" + r.get().getCycleSequenceNumber() + ".csv";
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + name + "\"")
                .body(csvExporter.toCsv(r.get().getEvents()));
    }
}
