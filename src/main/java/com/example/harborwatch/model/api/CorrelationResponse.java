package com.example.harborwatch.model.api;

import com.example.harborwatch.model.SkippedRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of one correlation pass")
public record CorrelationResponse(
        @Schema(description = "Calibration frame used", example = "alexandria-western-harbour") String frame,
        @Schema(description = "Tolerance radius applied in meters", example = "1000") double toleranceMeters,
        @Schema(description = "Number of detections processed", example = "10") int totalTargets,
        @Schema(description = "Detections matched to a registry entry", example = "8") long legalCount,
        @Schema(description = "Detections without a registry entry in range", example = "2") long darkCount,
        @Schema(description = "Per-detection results in request order") List<TargetResponse> targets,
        @Schema(description = "Registry records excluded from this pass") List<SkippedRecord> skippedRecords,
        @Schema(description = "Processing time in milliseconds", example = "3") long elapsedMs) {
}
