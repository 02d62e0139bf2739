package com.seismic.sentinel.monitor.model;

import com.seismic.sentinel.monitor.enums.DepthBucket;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.RecencyBucket;

import java.time.Instant;

/**
 * Per-event derived attributes. {@code hourUtc} is the UTC hour of day (0-23) of {@code observedAt};
 * {@code clusterId} is null for events without a known location.
 */
public record EventFeatures(
        String eventId,
        Instant observedAt,
        double magnitude,
        String place,
        boolean tsunami,
        MagnitudeBucket magnitudeBucket,
        RecencyBucket recencyBucket,
        DepthBucket depthBucket,
        int hourUtc,
        String clusterId
) {
}
