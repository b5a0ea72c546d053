package com.example.harborwatch.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchResultTest {

    private static final Detection DETECTION = new Detection("det-1", new BoundingBox(10, 10, 30, 30));
    private static final GeoPoint POSITION = new GeoPoint(31.1925, 29.8605);

    @Test
    void detectionCenterIsTheBoundingBoxMidpoint() {
        assertThat(DETECTION.centerPixel()).isEqualTo(new PixelPoint(20, 20));
    }

    @Test
    void rejectsLegalStatusWithoutMatchedEntry() {
        assertThatThrownBy(() -> new MatchResult(DETECTION, POSITION, null, null, MatchStatus.LEGAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDistanceWithoutMatchedEntry() {
        assertThatThrownBy(() -> new MatchResult(DETECTION, POSITION, null, 12.0, MatchStatus.DARK))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvertedBoundingBox() {
        assertThatThrownBy(() -> new BoundingBox(30, 10, 10, 30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("x2");
    }
}
