package com.seismic.sentinel.monitor.service.analysis.rules;

import com.seismic.sentinel.monitor.enums.ComparisonOperator;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.RecencyBucket;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventFeatures;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Recent activity with nothing at or above the MODERATE breakpoint anywhere in the window: keep watching.
 */
@Component
@Order(50)
public class RoutineMonitoringRule implements AnalysisRule {

    public static final String NAME = "routine-monitoring";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
        if (features.isEmpty()) return Optional.empty();

        double moderate = MagnitudeBucket.MODERATE.lowerBound(features.getMagnitudeThresholds());
        double max = features.getAggregates().getMaxMagnitude();
        if (max >= moderate) return Optional.empty();

        List<EventFeatures> lastHour = features.getEventFeatures().stream()
                .filter(f -> f.recencyBucket() == RecencyBucket.LAST_HOUR)
                .toList();
        if (lastHour.isEmpty()) return Optional.empty();

        return Optional.of(Recommendation.builder()
                .ruleName(NAME)
                .action("CONTINUE_MONITORING")
                .summary("No strong events; " + lastHour.size() + " low-magnitude event(s) in the last hour")
                .subjectIds(lastHour.stream().map(EventFeatures::eventId).sorted().toList())
                .severity(Severity.LOW)
                .rationale(List.of(
                        new RationaleCondition("window", "lastHourCount", ComparisonOperator.GTE, 1, lastHour.size()),
                        new RationaleCondition("window", "maxMagnitude", ComparisonOperator.LT, moderate, max)))
                .latestObservedAt(lastHour.stream().map(EventFeatures::observedAt).max(Instant::compareTo).orElse(null))
                .generatedAt(features.getNow())
                .build());
    }
}
