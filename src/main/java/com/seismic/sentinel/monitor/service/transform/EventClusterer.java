package com.seismic.sentinel.monitor.service.transform;

import com.seismic.sentinel.monitor.model.EventRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups located events by pairwise proximity with union-find. Two events are linked when they are
 * within {@code radiusKm} of each other and observed at most {@code window} apart; clusters are the
 * transitive closure of those links. Quadratic in the number of events, which the retention window bounds.
 */
final class EventClusterer {

    private static final String CLUSTER_PREFIX = "cluster:";

    private final double radiusKm;
    private final Duration window;

    EventClusterer(double radiusKm, Duration window) {
        this.radiusKm = radiusKm;
        this.window = window;
    }

    /**
     * @return event id to cluster id for every located event; unlocated events are absent
     */
    Map<String, String> assign(List<EventRecord> events) {
        List<EventRecord> located = new ArrayList<>();
        for (EventRecord e : events) {
            if (e.hasLocation()) located.add(e);
        }
        // sort by id so that the result does not depend on input order
        located.sort((a, b) -> a.getId().compareTo(b.getId()));

        int n = located.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        for (int i = 0; i < n; i++) {
            EventRecord a = located.get(i);
            for (int j = i + 1; j < n; j++) {
                EventRecord b = located.get(j);
                if (near(a, b)) union(parent, i, j);
            }
        }

        // root index -> smallest member id; ids are sorted so the first member seen is the smallest
        Map<Integer, String> rootToId = new HashMap<>();
        Map<String, String> out = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            String id = located.get(i).getId();
            String clusterId = rootToId.computeIfAbsent(find(parent, i), r -> CLUSTER_PREFIX + id);
            out.put(id, clusterId);
        }
        return out;
    }

    private boolean near(EventRecord a, EventRecord b) {
        Duration gap = Duration.between(a.getObservedAt(), b.getObservedAt()).abs();
        if (gap.compareTo(window) > 0) return false;
        return a.getLocation().distanceKm(b.getLocation()) <= radiusKm;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra == rb) return;
        // keep the lower index as root
        if (ra < rb) parent[rb] = ra;
        else parent[ra] = rb;
    }
}
