package com.example.harborwatch.model.api;

import com.example.harborwatch.model.CalibrationFrame;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Inline calibration frame for imagery that has no configured frame")
public record CalibrationRequest(
        @Schema(description = "Latitude of the top image edge", example = "31.202") @NotNull Double north,
        @Schema(description = "Latitude of the bottom image edge", example = "31.168") @NotNull Double south,
        @Schema(description = "Longitude of the left image edge", example = "29.855") @NotNull Double west,
        @Schema(description = "Longitude of the right image edge", example = "29.885") @NotNull Double east,
        @Schema(description = "Image width in pixels", example = "1178") @NotNull Integer imageWidth,
        @Schema(description = "Image height in pixels", example = "665") @NotNull Integer imageHeight) {

    public CalibrationFrame toFrame() {
        return new CalibrationFrame(north, south, west, east, imageWidth, imageHeight);
    }
}
