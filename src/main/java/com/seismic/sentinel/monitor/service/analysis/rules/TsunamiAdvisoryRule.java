package com.seismic.sentinel.monitor.service.analysis.rules;

import com.seismic.sentinel.monitor.enums.ComparisonOperator;
import com.seismic.sentinel.monitor.enums.RecencyBucket;
import com.seismic.sentinel.monitor.enums.Severity;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventFeatures;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Events the source flags with tsunami potential, observed within the last day.
 */
@Component
@Order(30)
public class TsunamiAdvisoryRule implements AnalysisRule {

    public static final String NAME = "tsunami-advisory";

    private static final double DAY_HOURS = 24.0;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
        List<EventFeatures> flagged = features.getEventFeatures().stream()
                .filter(EventFeatures::tsunami)
                .filter(f -> f.recencyBucket().isWithin(RecencyBucket.LAST_DAY))
                .sorted(Comparator.comparing(EventFeatures::eventId))
                .toList();
        if (flagged.isEmpty()) return Optional.empty();

        List<String> subjects = new ArrayList<>(flagged.size());
        List<RationaleCondition> rationale = new ArrayList<>();
        Instant latest = null;
        for (EventFeatures f : flagged) {
            subjects.add(f.eventId());
            double ageHours = Math.max(0L, Duration.between(f.observedAt(), features.getNow()).toSeconds()) / 3600.0;
            rationale.add(new RationaleCondition(f.eventId(), "tsunamiFlag", ComparisonOperator.EQ, 1, 1));
            rationale.add(new RationaleCondition(f.eventId(), "ageHours", ComparisonOperator.LT, DAY_HOURS, ageHours));
            if (latest == null || f.observedAt().isAfter(latest)) latest = f.observedAt();
        }

        return Optional.of(Recommendation.builder()
                .ruleName(NAME)
                .action("VERIFY_TSUNAMI_WARNINGS")
                .summary(flagged.size() + " event(s) flagged with tsunami potential in the last 24h")
                .subjectIds(List.copyOf(subjects))
                .severity(Severity.EXTREME)
                .rationale(List.copyOf(rationale))
                .latestObservedAt(latest)
                .generatedAt(features.getNow())
                .build());
    }
}
