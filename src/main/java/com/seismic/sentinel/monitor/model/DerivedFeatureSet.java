package com.seismic.sentinel.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything the transform step computes for one cycle. Rebuilt from the store every cycle.
 */
@Value
@Builder
public class DerivedFeatureSet {
    Instant now;
    List<Double> magnitudeThresholds;
    List<EventFeatures> eventFeatures;
    List<EventCluster> clusters;
    WindowAggregates aggregates;

    public boolean isEmpty() {
        return eventFeatures.isEmpty();
    }
}
