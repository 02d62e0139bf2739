package com.seismic.sentinel.monitor.web;

import com.seismic.sentinel.monitor.common.exception.Http;
import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineOrchestrator orchestrator;

    @GetMapping("/state")
    public ResponseEntity<?> state() {
        return Http.from(orchestrator.getPipelineState());
    }

    /**
     * Runs a cycle on the request thread. Rejected with 409 while a scheduled cycle is running.
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        return Http.from(orchestrator.triggerCycle());
    }

    @PostMapping("/store/clear")
    public ResponseEntity<?> clearStore() {
        return Http.from(orchestrator.clearStore());
    }
}
