package com.seismic.sentinel.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One feed feature after boundary validation. {@code location} is null when the coordinates are missing or invalid.
 */
@Value
@Builder
public class RawEvent {
    String id;
    Instant observedAt;
    Instant sourceUpdatedAt;
    double magnitude;
    GeoLocation location;

    // descriptive fields carried through to the snapshot
    String place;
    String url;
    String status;
    boolean tsunami;
    String eventType;
}
