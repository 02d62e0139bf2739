package com.seismic.sentinel.monitor.service.pipeline;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolling window over the last N cycle durations (ms); percentiles are computed on demand.
 */
public final class PercentileWindow {
    private final long[] buf;
    private final AtomicInteger idx = new AtomicInteger(0);
    private volatile int count = 0;

    public PercentileWindow(int capacity) {
        this.buf = new long[Math.max(10, capacity)];
    }

    public void record(long durationMs) {
        int slot = Math.floorMod(idx.getAndIncrement(), buf.length);
        buf[slot] = Math.max(0L, durationMs);
        int c = count;
        if (c < buf.length) count = c + 1;
    }

    /** Return p at 0..100 (e.g., 95) or -1 if nothing was recorded yet. */
    public long percentile(int p) {
        int c = count;
        if (c <= 0) return -1;
        long[] copy = Arrays.copyOf(buf, c);
        Arrays.sort(copy);
        int rank = (int) Math.ceil((p / 100.0) * c) - 1;
        rank = Math.max(0, Math.min(c - 1, rank));
        return copy[rank];
    }
}
