package com.example.harborwatch.geo;

import com.example.harborwatch.model.CalibrationFrame;
import com.example.harborwatch.model.GeoPoint;
import com.example.harborwatch.model.PixelPoint;

import java.util.Objects;

/**
 * Maps image pixels to geographic coordinates by linear interpolation inside a
 * {@link CalibrationFrame}. This is not a map projection; at harbour-scale
 * extents the error against a true projection is negligible.
 * <p>
 * Pixels outside the image are not rejected. They extrapolate linearly past
 * the frame bounds, so callers that need strict bounds must check
 * {@link #isInsideImage(PixelPoint, CalibrationFrame)} themselves.
 */
public final class CoordinateTransform {

    private CoordinateTransform() {
    }

    public static GeoPoint pixelToGeo(PixelPoint point, CalibrationFrame frame) {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(frame, "frame");
        // y grows southwards, x grows eastwards
        double lat = frame.north() - (point.y() / frame.imageHeight()) * (frame.north() - frame.south());
        double lon = frame.west() + (point.x() / frame.imageWidth()) * (frame.east() - frame.west());
        return new GeoPoint(lat, lon);
    }

    public static boolean isInsideImage(PixelPoint point, CalibrationFrame frame) {
        return point.x() >= 0 && point.x() <= frame.imageWidth()
                && point.y() >= 0 && point.y() <= frame.imageHeight();
    }
}
