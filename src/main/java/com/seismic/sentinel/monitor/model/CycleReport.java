package com.seismic.sentinel.monitor.model;

import com.seismic.sentinel.monitor.enums.CycleOutcome;

import java.time.Instant;

public record CycleReport(
        long cycleNumber,
        CycleOutcome outcome,
        Instant startedAt,
        long durationMs,
        int fetched,
        int skippedRecords,
        int added,
        int revised,
        int unchanged,
        int evicted,
        int recommendations,
        String error
) {
}
