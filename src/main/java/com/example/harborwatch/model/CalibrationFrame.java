package com.example.harborwatch.model;

import com.example.harborwatch.exception.ConfigurationException;

/**
 * Linear mapping between the pixel grid of one imagery source and the
 * geographic rectangle it covers. The north-west corner of the rectangle
 * corresponds to pixel {@code (0, 0)}.
 */
public record CalibrationFrame(
        double north,
        double south,
        double west,
        double east,
        int imageWidth,
        int imageHeight) {

    public CalibrationFrame {
        if (!Double.isFinite(north) || !Double.isFinite(south) || !Double.isFinite(west) || !Double.isFinite(east)) {
            throw new ConfigurationException("Calibration bounds must be finite numbers");
        }
        if (north <= south) {
            throw new ConfigurationException(
                    "Calibration frame north bound (" + north + ") must be greater than its south bound (" + south + ")");
        }
        if (east <= west) {
            throw new ConfigurationException(
                    "Calibration frame east bound (" + east + ") must be greater than its west bound (" + west + ")");
        }
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new ConfigurationException(
                    "Calibration image dimensions must be positive but were " + imageWidth + "x" + imageHeight);
        }
    }
}
