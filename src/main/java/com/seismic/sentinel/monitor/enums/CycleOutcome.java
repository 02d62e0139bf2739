package com.seismic.sentinel.monitor.enums;

public enum CycleOutcome {
    PUBLISHED,
    FETCH_FAILED,
    PROCESSING_FAILED
}
