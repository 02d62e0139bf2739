package com.seismic.sentinel.monitor.model;

/**
 * Epicentre coordinates. {@code depthKm} is null when the feed does not report a depth.
 */
public record GeoLocation(double latitude, double longitude, Double depthKm) {

    private static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Great-circle (haversine) distance in kilometres.
     */
    public double distanceKm(GeoLocation other) {
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLon = Math.toRadians(other.longitude - longitude);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude)) *
                        Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
