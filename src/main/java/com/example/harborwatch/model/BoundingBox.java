package com.example.harborwatch.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle describing a detected vessel inside a source image.
 * Coordinates follow the image pixel grid with the origin located in the
 * top-left corner; {@code (x1, y1)} is the top-left and {@code (x2, y2)} the
 * bottom-right corner.
 */
@Schema(description = "Axis-aligned rectangle describing a detected vessel")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "206") double x1,
        @Schema(description = "Y coordinate of the top-left corner", example = "176") double y1,
        @Schema(description = "X coordinate of the bottom-right corner", example = "226") double x2,
        @Schema(description = "Y coordinate of the bottom-right corner", example = "196") double y2) {

    public BoundingBox {
        if (x1 < 0 || y1 < 0) {
            throw new IllegalArgumentException("Bounding box coordinates must not be negative");
        }
        if (x2 < x1) {
            throw new IllegalArgumentException("Bounding box x2 must not be smaller than x1");
        }
        if (y2 < y1) {
            throw new IllegalArgumentException("Bounding box y2 must not be smaller than y1");
        }
    }

    public PixelPoint center() {
        return new PixelPoint((x1 + x2) / 2, (y1 + y2) / 2);
    }
}
