package com.seismic.sentinel.monitor.model;

import com.seismic.sentinel.monitor.enums.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Recommendation {
    String ruleName;
    String action;
    String summary;
    List<String> subjectIds;
    Severity severity;
    List<RationaleCondition> rationale;
    /** Most recent observation among the subjects, used for ranking. */
    Instant latestObservedAt;
    Instant generatedAt;
}
