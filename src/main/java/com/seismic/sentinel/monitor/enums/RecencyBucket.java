package com.seismic.sentinel.monitor.enums;

import java.time.Duration;
import java.time.Instant;

public enum RecencyBucket {
    LAST_HOUR(Duration.ofHours(1)),
    LAST_DAY(Duration.ofHours(24)),
    LAST_WEEK(Duration.ofDays(7)),
    OLDER(null);

    private final Duration limit;

    RecencyBucket(Duration limit) {
        this.limit = limit;
    }

    /**
     * Bucket for an event observed at {@code observedAt}, relative to {@code now}.
     * Timestamps ahead of {@code now} count as LAST_HOUR.
     */
    public static RecencyBucket of(Instant observedAt, Instant now) {
        Duration age = Duration.between(observedAt, now);
        for (RecencyBucket b : values()) {
            if (b.limit != null && age.compareTo(b.limit) < 0) {
                return b;
            }
        }
        return OLDER;
    }

    public boolean isWithin(RecencyBucket other) {
        return ordinal() <= other.ordinal();
    }
}
