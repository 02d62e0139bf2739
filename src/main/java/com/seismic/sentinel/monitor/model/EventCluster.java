package com.seismic.sentinel.monitor.model;

import java.time.Instant;
import java.util.List;

/**
 * Events grouped by spatial and temporal proximity. {@code memberIds} is sorted.
 */
public record EventCluster(
        String clusterId,
        List<String> memberIds,
        double maxMagnitude,
        Instant latestObservedAt,
        int countAboveModerate
) {
    public int size() {
        return memberIds.size();
    }
}
