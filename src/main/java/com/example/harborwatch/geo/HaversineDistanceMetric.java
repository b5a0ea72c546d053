package com.example.harborwatch.geo;

import com.example.harborwatch.model.GeoPoint;

/**
 * Haversine distance on a spherical Earth. Relative error stays well below a
 * meter per kilometer at harbour scales, which is the only range this service
 * operates in.
 */
public class HaversineDistanceMetric implements DistanceMetric {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    @Override
    public double greatCircleDistanceMeters(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLon = Math.toRadians(b.lon() - a.lon());
        double sinLat = Math.sin(dLat / 2);
        double sinLon = Math.sin(dLon / 2);
        double h = sinLat * sinLat
                + Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat())) * sinLon * sinLon;
        // rounding can push h just outside [0, 1]
        double clamped = Math.max(0.0, Math.min(1.0, h));
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(clamped));
    }
}
