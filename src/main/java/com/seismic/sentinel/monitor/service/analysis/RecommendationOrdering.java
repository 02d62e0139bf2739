package com.seismic.sentinel.monitor.service.analysis;

import com.seismic.sentinel.monitor.model.Recommendation;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Ranking: severity descending, then most recent subject first, then subject ids in lexicographic order.
 */
public final class RecommendationOrdering {

    public static final Comparator<Recommendation> RANKING =
            Comparator.comparing(Recommendation::getSeverity).reversed()
                    .thenComparing(Recommendation::getLatestObservedAt,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(Recommendation::getSubjectIds, RecommendationOrdering::compareIds)
                    .thenComparing(Recommendation::getRuleName);

    private RecommendationOrdering() {
    }

    static int compareIds(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
