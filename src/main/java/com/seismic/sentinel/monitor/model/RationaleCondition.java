package com.seismic.sentinel.monitor.model;

import com.seismic.sentinel.monitor.enums.ComparisonOperator;

/**
 * One satisfied predicate behind a recommendation: {@code subject.feature operator threshold},
 * with the observed value that satisfied it.
 */
public record RationaleCondition(
        String subject,
        String feature,
        ComparisonOperator operator,
        double threshold,
        double observed
) {
    public String describe() {
        return subject + "." + feature + "=" + observed + " " + operator.symbol() + " " + threshold;
    }
}
