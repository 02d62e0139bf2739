package com.seismic.sentinel.monitor.service.analysis.rules;

import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.enums.ComparisonOperator;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventCluster;
import com.seismic.sentinel.monitor.model.EventFeatures;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Strong events that stand alone, i.e. are not part of a cluster the cluster rule looks at.
 * The strongest of them becomes the subject.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class SignificantEventRule implements AnalysisRule {

    public static final String NAME = "significant-event";

    private static final Comparator<EventFeatures> STRONGEST_FIRST =
            Comparator.comparingDouble(EventFeatures::magnitude).reversed()
                    .thenComparing(EventFeatures::observedAt, Comparator.reverseOrder())
                    .thenComparing(EventFeatures::eventId);

    private final MonitorProperties props;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
        double significant = props.getRules().getSignificantMagnitude();
        int minEvents = props.getRules().getClusterMinEvents();

        Set<String> clustered = new HashSet<>();
        for (EventCluster c : features.getClusters()) {
            if (c.size() >= minEvents) clustered.add(c.clusterId());
        }

        List<EventFeatures> strong = features.getEventFeatures().stream()
                .filter(f -> f.magnitude() >= significant)
                .filter(f -> f.clusterId() == null || !clustered.contains(f.clusterId()))
                .sorted(STRONGEST_FIRST)
                .toList();
        if (strong.isEmpty()) return Optional.empty();

        EventFeatures top = strong.get(0);
        List<Double> thresholds = features.getMagnitudeThresholds();
        Severity severity = Severity.forMagnitude(top.magnitude(),
                MagnitudeBucket.STRONG.lowerBound(thresholds), MagnitudeBucket.MAJOR.lowerBound(thresholds));
        String where = top.place() == null ? top.eventId() : top.place();

        return Optional.of(Recommendation.builder()
                .ruleName(NAME)
                .action("ALERT_REGIONAL_OPERATIONS")
                .summary("Strong event detected at " + where + " (mag " + top.magnitude() + ")")
                .subjectIds(List.of(top.eventId()))
                .severity(severity)
                .rationale(List.of(
                        new RationaleCondition(top.eventId(), "magnitude", ComparisonOperator.GTE, significant, top.magnitude()),
                        new RationaleCondition("window", "isolatedSignificantCount", ComparisonOperator.GTE, 1, strong.size())))
                .latestObservedAt(top.observedAt())
                .generatedAt(features.getNow())
                .build());
    }
}
