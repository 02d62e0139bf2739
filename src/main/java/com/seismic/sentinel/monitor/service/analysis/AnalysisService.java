package com.seismic.sentinel.monitor.service.analysis;

import com.seismic.sentinel.monitor.common.exception.ProcessingException;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.RationaleCondition;
import com.seismic.sentinel.monitor.model.Recommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the ordered rule list over a feature set and ranks what the rules emit.
 */
@Slf4j
@Service
public class AnalysisService {

    private final List<AnalysisRule> rules;

    /**
     * @param rules rule beans, in {@code @Order} sequence
     */
    public AnalysisService(List<AnalysisRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("Analysis rules: {}", this.rules.stream().map(AnalysisRule::name).toList());
    }

    public List<Recommendation> analyze(DerivedFeatureSet derived) {
        if (derived == null) throw new ProcessingException("No feature set to analyze");

        List<Recommendation> out = new ArrayList<>();
        for (AnalysisRule rule : rules) {
            Optional<Recommendation> r;
            try {
                r = rule.evaluate(derived);
            } catch (RuntimeException e) {
                throw new ProcessingException("Rule " + rule.name() + " failed: " + e.getMessage(), e);
            }
            r.ifPresent(out::add);
        }
        out.sort(RecommendationOrdering.RANKING);
        if (log.isDebugEnabled()) {
            for (Recommendation r : out) {
                log.debug("{} [{}] {}: {}", r.getRuleName(), r.getSeverity(), r.getSubjectIds(),
                        r.getRationale().stream().map(RationaleCondition::describe).toList());
            }
        }
        return List.copyOf(out);
    }

    public List<String> ruleNames() {
        return rules.stream().map(AnalysisRule::name).toList();
    }
}
