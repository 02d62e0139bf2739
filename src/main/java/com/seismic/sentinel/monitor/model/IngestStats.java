package com.seismic.sentinel.monitor.model;

public record IngestStats(int added, int revised, int unchanged) {

    public static final IngestStats EMPTY = new IngestStats(0, 0, 0);
}
