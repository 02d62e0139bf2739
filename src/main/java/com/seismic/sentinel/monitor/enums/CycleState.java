package com.seismic.sentinel.monitor.enums;

/**
 * Refresh cycle states. A cycle always ends in IDLE; PUBLISHED is skipped when fetching or processing fails.
 */
public enum CycleState {
    IDLE,
    FETCHING,
    PROCESSING,
    PUBLISHED
}
