package com.seismic.sentinel.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable publication unit of one cycle. Replaced wholesale; readers holding an older instance keep a valid view.
 */
@Value
@Builder
public class Snapshot {
    List<EventRecord> events;
    DerivedFeatureSet derivedFeatures;
    List<Recommendation> recommendations;
    Instant cycleTimestamp;
    long cycleSequenceNumber;
}
