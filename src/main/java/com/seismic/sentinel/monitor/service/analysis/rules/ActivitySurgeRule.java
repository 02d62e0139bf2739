package com.seismic.sentinel.monitor.service.analysis.rules;

import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.enums.ComparisonOperator;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventFeatures;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.model.WindowAggregates;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Rate of newly observed events over the last poll interval reaching the surge threshold.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class ActivitySurgeRule implements AnalysisRule {

    public static final String NAME = "activity-surge";

    private final MonitorProperties props;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
        WindowAggregates agg = features.getAggregates();
        double threshold = props.getRules().getSurgeRatePerHour();
        if (agg.getNewEventCount() == 0 || agg.getNewEventRatePerHour() < threshold) return Optional.empty();

        Instant since = features.getNow().minus(props.getPollInterval());
        List<EventFeatures> fresh = features.getEventFeatures().stream()
                .filter(f -> !f.observedAt().isBefore(since))
                .toList();
        List<String> subjects = fresh.stream().map(EventFeatures::eventId).sorted().toList();
        Instant latest = fresh.stream().map(EventFeatures::observedAt).max(Instant::compareTo).orElse(null);

        return Optional.of(Recommendation.builder()
                .ruleName(NAME)
                .action("INCREASE_MONITORING_CADENCE")
                .summary("Activity surge: " + agg.getNewEventCount() + " new event(s) in the last "
                        + props.getPollIntervalSeconds() + "s")
                .subjectIds(subjects)
                .severity(Severity.MEDIUM)
                .rationale(List.of(
                        new RationaleCondition("window", "newEventRatePerHour", ComparisonOperator.GTE, threshold, agg.getNewEventRatePerHour())))
                .latestObservedAt(latest)
                .generatedAt(features.getNow())
                .build());
    }
}
