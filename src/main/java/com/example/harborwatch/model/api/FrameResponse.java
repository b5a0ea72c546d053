package com.example.harborwatch.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Configured calibration frame")
public record FrameResponse(
        String name,
        double north,
        double south,
        double west,
        double east,
        int imageWidth,
        int imageHeight,
        @Schema(description = "Whether requests without a frame use this one") boolean defaultFrame) {
}
