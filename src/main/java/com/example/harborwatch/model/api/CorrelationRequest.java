package com.example.harborwatch.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

@Schema(description = "Detections to correlate against the vessel registry")
public record CorrelationRequest(
        @Schema(description = "Name of a configured calibration frame; the default frame is used when omitted",
                example = "alexandria-western-harbour")
        String frame,
        @Schema(description = "Inline calibration frame, takes precedence over the named frame")
        @Valid CalibrationRequest calibration,
        @Schema(description = "Tolerance radius in meters; the configured radius is used when omitted", example = "1000")
        Double toleranceMeters,
        @Schema(description = "Detector output for one image")
        @NotNull @Valid List<@NotNull @Valid DetectionRequest> detections,
        @Schema(description = "Raw registry records (ship_id/mmsi/id, ship_name/name, lat/latitude, lon/longitude); "
                + "the configured registry is used when omitted")
        List<Map<String, Object>> registry) {
}
