package com.example.harborwatch.model.api;

import com.example.harborwatch.model.ColorHint;
import com.example.harborwatch.model.MatchStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Classified, geolocated detection")
public record TargetResponse(
        @Schema(description = "Detection identifier", example = "det-1") String detectionId,
        @Schema(description = "Bounding box as [x1, y1, x2, y2]") List<Double> bbox,
        @Schema(description = "Derived latitude", example = "31.19249") double lat,
        @Schema(description = "Derived longitude", example = "29.86050") double lon,
        @Schema(description = "Correlation status", example = "LEGAL") MatchStatus status,
        @Schema(description = "Display label", example = "ALEX STAR") String label,
        @Schema(description = "Rendering colour hint", example = "GREEN") ColorHint color,
        @Schema(description = "Matched registry identifier, null for dark ships", example = "235000111") String matchedId,
        @Schema(description = "Matched registry name, null for dark ships", example = "ALEX STAR") String matchedName,
        @Schema(description = "Distance to the matched entry in meters, null for dark ships", example = "1.2") Double distanceMeters) {
}
