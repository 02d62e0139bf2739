package com.seismic.sentinel.monitor.enums;

import com.seismic.sentinel.monitor.common.exception.ValidationException;

import java.util.List;

/**
 * Magnitude categories. The breakpoints are configured: {@code thresholds.get(i)} is the
 * lower bound of {@code values()[i + 1]}, so four ascending values define the five buckets.
 */
public enum MagnitudeBucket {
    MINOR,
    LIGHT,
    MODERATE,
    STRONG,
    MAJOR;

    public static final int BREAKPOINTS = values().length - 1;

    public static MagnitudeBucket classify(double magnitude, List<Double> thresholds) {
        if (thresholds == null || thresholds.size() != BREAKPOINTS) {
            throw new ValidationException("Expected " + BREAKPOINTS + " magnitude breakpoints, got "
                    + (thresholds == null ? 0 : thresholds.size()));
        }
        MagnitudeBucket bucket = MINOR;
        for (int i = 0; i < BREAKPOINTS; i++) {
            if (magnitude >= thresholds.get(i)) {
                bucket = values()[i + 1];
            }
        }
        return bucket;
    }

    /**
     * Lower bound of this bucket, or negative infinity for MINOR.
     */
    public double lowerBound(List<Double> thresholds) {
        return ordinal() == 0 ? Double.NEGATIVE_INFINITY : thresholds.get(ordinal() - 1);
    }
}
