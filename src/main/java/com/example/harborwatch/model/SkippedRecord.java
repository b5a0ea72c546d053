package com.example.harborwatch.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Registry record excluded from correlation")
public record SkippedRecord(
        @Schema(description = "Zero-based position of the record in the supplied registry", example = "3") int index,
        @Schema(description = "Why the record was excluded", example = "No resolvable longitude (tried lon, longitude)") String reason) {
}
