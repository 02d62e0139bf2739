package com.seismic.sentinel.monitor.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one successful fetch. {@code skipped} counts features dropped as malformed.
 */
@Value
public class FeedBatch {
    List<RawEvent> events;
    int skipped;
    Instant fetchedAt;

    public int fetched() {
        return events.size();
    }
}
