package com.example.harborwatch.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Geographic position in decimal degrees. No range clamp is applied, so
 * positions extrapolated beyond a calibration frame are representable.
 */
@Schema(description = "Geographic position in decimal degrees")
public record GeoPoint(
        @Schema(description = "Latitude in degrees", example = "31.1925") double lat,
        @Schema(description = "Longitude in degrees", example = "29.8605") double lon) {
}
