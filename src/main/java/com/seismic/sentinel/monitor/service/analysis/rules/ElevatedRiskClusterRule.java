package com.seismic.sentinel.monitor.service.analysis.rules;

import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.enums.ComparisonOperator;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.RecencyBucket;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventCluster;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Clusters with enough members, enough events at or above the MODERATE breakpoint, and a latest member observed
 * within the last 24 hours. All qualifying clusters are reported in one recommendation.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class ElevatedRiskClusterRule implements AnalysisRule {

    public static final String NAME = "elevated-risk-cluster";
    private static final double RECENT_HOURS = 24;

    private final MonitorProperties props;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
        List<Double> thresholds = features.getMagnitudeThresholds();
        double moderate = MagnitudeBucket.MODERATE.lowerBound(thresholds);
        int minEvents = props.getRules().getClusterMinEvents();
        int minAbove = props.getRules().getClusterMinAboveModerate();

        List<String> subjects = new ArrayList<>();
        List<RationaleCondition> rationale = new ArrayList<>();
        Severity severity = null;
        Instant latest = null;
        int aboveTotal = 0;

        // clusters arrive sorted by id
        for (EventCluster c : features.getClusters()) {
            if (c.size() < minEvents || c.countAboveModerate() < minAbove) continue;
            if (!RecencyBucket.of(c.latestObservedAt(), features.getNow()).isWithin(RecencyBucket.LAST_DAY)) continue;

            subjects.add(c.clusterId());
            rationale.add(new RationaleCondition(c.clusterId(), "memberCount", ComparisonOperator.GTE, minEvents, c.size()));
            rationale.add(new RationaleCondition(c.clusterId(), "countAboveModerate", ComparisonOperator.GTE, minAbove, c.countAboveModerate()));
            rationale.add(new RationaleCondition(c.clusterId(), "maxMagnitude", ComparisonOperator.GTE, moderate, c.maxMagnitude()));
            rationale.add(new RationaleCondition(c.clusterId(), "latestAgeHours", ComparisonOperator.LT,
                    RECENT_HOURS, ageHours(c.latestObservedAt(), features.getNow())));

            Severity s = Severity.forMagnitude(c.maxMagnitude(),
                    MagnitudeBucket.STRONG.lowerBound(thresholds), MagnitudeBucket.MAJOR.lowerBound(thresholds));
            if (severity == null || s.compareTo(severity) > 0) severity = s;
            if (latest == null || c.latestObservedAt().isAfter(latest)) latest = c.latestObservedAt();
            aboveTotal += c.countAboveModerate();
        }
        if (subjects.isEmpty()) return Optional.empty();

        return Optional.of(Recommendation.builder()
                .ruleName(NAME)
                .action("REVIEW_CLUSTER_ACTIVITY")
                .summary("Elevated-risk cluster: " + subjects.size() + " cluster(s), " + aboveTotal
                        + " event(s) at or above moderate threshold " + moderate)
                .subjectIds(List.copyOf(subjects))
                .severity(severity)
                .rationale(List.copyOf(rationale))
                .latestObservedAt(latest)
                .generatedAt(features.getNow())
                .build());
    }

    private static double ageHours(Instant observedAt, Instant now) {
        // future timestamps count as age zero, like RecencyBucket
        return Math.max(0L, Duration.between(observedAt, now).toMillis()) / 3_600_000d;
    }
}
