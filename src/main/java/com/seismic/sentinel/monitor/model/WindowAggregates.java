package com.seismic.sentinel.monitor.model;

import com.seismic.sentinel.monitor.enums.DepthBucket;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.RecencyBucket;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class WindowAggregates {
    int totalEvents;
    Map<MagnitudeBucket, Integer> countByMagnitude;
    Map<RecencyBucket, Integer> countByRecency;
    Map<DepthBucket, Integer> countByDepth;

    /** Events observed within the last poll interval. */
    int newEventCount;
    /** {@code newEventCount} per hour of poll interval. */
    double newEventRatePerHour;

    double averageMagnitude;
    double maxMagnitude;
    int missingLocationCount;
}
