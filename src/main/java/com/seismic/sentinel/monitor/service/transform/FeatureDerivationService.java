package com.seismic.sentinel.monitor.service.transform;

import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.enums.DepthBucket;
import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import com.seismic.sentinel.monitor.enums.RecencyBucket;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventCluster;
import com.seismic.sentinel.monitor.model.EventFeatures;
import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.WindowAggregates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives per-event and window-level features from a store view.
 * Pure: the result depends only on the events, {@code now} and configuration.
 */
@Service
@RequiredArgsConstructor
public class FeatureDerivationService {

    private final MonitorProperties props;

    public DerivedFeatureSet derive(List<EventRecord> eventsView, Instant now) {
        List<Double> thresholds = List.copyOf(props.getMagnitudeThresholds());
        double moderate = props.thresholdOf(MagnitudeBucket.MODERATE);

        Map<String, String> clusterOf = new EventClusterer(props.getClusterRadiusKm(), props.getClusterWindow())
                .assign(eventsView);

        Map<MagnitudeBucket, Integer> byMagnitude = zeroed(MagnitudeBucket.class);
        Map<RecencyBucket, Integer> byRecency = zeroed(RecencyBucket.class);
        Map<DepthBucket, Integer> byDepth = zeroed(DepthBucket.class);

        Instant newSince = now.minus(props.getPollInterval());
        int newEvents = 0;
        int missingLocation = 0;
        double magSum = 0.0;
        double magMax = 0.0;

        List<EventFeatures> features = new ArrayList<>(eventsView.size());
        Map<String, List<EventRecord>> members = new TreeMap<>();

        for (EventRecord e : eventsView) {
            MagnitudeBucket mb = MagnitudeBucket.classify(e.getMagnitude(), thresholds);
            RecencyBucket rb = RecencyBucket.of(e.getObservedAt(), now);
            DepthBucket db = DepthBucket.of(e.hasLocation() ? e.getLocation().depthKm() : null);
            String clusterId = clusterOf.get(e.getId());

            int hourUtc = e.getObservedAt().atZone(ZoneOffset.UTC).getHour();

            features.add(new EventFeatures(e.getId(), e.getObservedAt(), e.getMagnitude(), e.getPlace(),
                    e.isTsunami(), mb, rb, db, hourUtc, clusterId));

            byMagnitude.merge(mb, 1, Integer::sum);
            byRecency.merge(rb, 1, Integer::sum);
            byDepth.merge(db, 1, Integer::sum);

            if (!e.getObservedAt().isBefore(newSince)) newEvents++;
            if (!e.hasLocation()) missingLocation++;
            magSum += e.getMagnitude();
            magMax = features.size() == 1 ? e.getMagnitude() : Math.max(magMax, e.getMagnitude());

            if (clusterId != null) members.computeIfAbsent(clusterId, k -> new ArrayList<>()).add(e);
        }

        List<EventCluster> clusters = new ArrayList<>(members.size());
        for (Map.Entry<String, List<EventRecord>> m : members.entrySet()) {
            clusters.add(toCluster(m.getKey(), m.getValue(), moderate));
        }

        int total = eventsView.size();
        double intervalHours = props.getPollInterval().toMillis() / (double) Duration.ofHours(1).toMillis();

        WindowAggregates aggregates = WindowAggregates.builder()
                .totalEvents(total)
                .countByMagnitude(Collections.unmodifiableMap(byMagnitude))
                .countByRecency(Collections.unmodifiableMap(byRecency))
                .countByDepth(Collections.unmodifiableMap(byDepth))
                .newEventCount(newEvents)
                .newEventRatePerHour(intervalHours > 0 ? newEvents / intervalHours : 0.0)
                .averageMagnitude(total == 0 ? 0.0 : magSum / total)
                .maxMagnitude(total == 0 ? 0.0 : magMax)
                .missingLocationCount(missingLocation)
                .build();

        return DerivedFeatureSet.builder()
                .now(now)
                .magnitudeThresholds(thresholds)
                .eventFeatures(List.copyOf(features))
                .clusters(List.copyOf(clusters))
                .aggregates(aggregates)
                .build();
    }

    private static EventCluster toCluster(String clusterId, List<EventRecord> members, double moderate) {
        List<String> ids = new ArrayList<>(members.size());
        double maxMag = Double.NEGATIVE_INFINITY;
        Instant latest = Instant.MIN;
        int aboveModerate = 0;
        for (EventRecord e : members) {
            ids.add(e.getId());
            maxMag = Math.max(maxMag, e.getMagnitude());
            if (e.getObservedAt().isAfter(latest)) latest = e.getObservedAt();
            if (e.getMagnitude() >= moderate) aboveModerate++;
        }
        Collections.sort(ids);
        return new EventCluster(clusterId, List.copyOf(ids), maxMag, latest, aboveModerate);
    }

    private static <E extends Enum<E>> Map<E, Integer> zeroed(Class<E> type) {
        Map<E, Integer> m = new EnumMap<>(type);
        for (E e : type.getEnumConstants()) m.put(e, 0);
        return m;
    }
}
