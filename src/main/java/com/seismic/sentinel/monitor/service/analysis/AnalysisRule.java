package com.seismic.sentinel.monitor.service.analysis;

import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.Recommendation;

import java.util.Optional;

/**
 * A deterministic predicate over one cycle's features. Implementations hold no state between cycles
 * and emit at most one recommendation, whose rationale lists the compared values and thresholds.
 */
public interface AnalysisRule {

    String name();

    Optional<Recommendation> evaluate(DerivedFeatureSet features);
}
