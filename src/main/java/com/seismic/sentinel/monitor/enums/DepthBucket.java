package com.seismic.sentinel.monitor.enums;

/**
 * Hypocentre depth categories in kilometres. UNKNOWN when the feed carries no depth.
 */
public enum DepthBucket {
    SHALLOW(10.0),
    INTERMEDIATE(50.0),
    DEEP(200.0),
    VERY_DEEP(Double.POSITIVE_INFINITY),
    UNKNOWN(Double.NaN);

    private final double upperKm;

    DepthBucket(double upperKm) {
        this.upperKm = upperKm;
    }

    public static DepthBucket of(Double depthKm) {
        if (depthKm == null || depthKm.isNaN()) return UNKNOWN;
        for (DepthBucket b : values()) {
            if (b != UNKNOWN && depthKm <= b.upperKm) return b;
        }
        return VERY_DEEP;
    }
}
