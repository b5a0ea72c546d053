package com.example.harborwatch.model;

import java.util.Objects;

/**
 * Unverified sighting produced by an external detector, given only as a
 * pixel-space bounding box.
 */
public record Detection(String id, BoundingBox boundingBox) {

    public Detection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(boundingBox, "boundingBox");
    }

    public PixelPoint centerPixel() {
        return boundingBox.center();
    }
}
