package com.example.harborwatch.model;

/**
 * Position on an image pixel grid with the origin in the top-left corner.
 */
public record PixelPoint(double x, double y) {
}
