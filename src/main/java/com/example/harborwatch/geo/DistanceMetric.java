package com.example.harborwatch.geo;

import com.example.harborwatch.model.GeoPoint;

/**
 * Measures the surface distance between two geographic positions. The
 * correlation engine only relies on the result being non-negative, symmetric
 * and zero for identical points, so alternative models can be wired in through
 * Spring configuration.
 */
public interface DistanceMetric {

    /**
     * @return great-circle distance in meters, never negative
     */
    double greatCircleDistanceMeters(GeoPoint a, GeoPoint b);
}
