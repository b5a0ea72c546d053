package com.example.harborwatch.exception;

/**
 * Raised when a correlation pass cannot run because its inputs describe a
 * malformed deployment: an invalid calibration frame, non-positive image
 * dimensions or a non-positive tolerance radius. The pass is aborted before
 * any detection is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
