package com.example.harborwatch.model.api;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(description = "Single detector output")
public record DetectionRequest(
        @Schema(description = "Per-run detection identifier; generated from the list position when omitted", example = "det-1")
        String id,
        @ArraySchema(arraySchema = @Schema(description = "Bounding box as [x1, y1, x2, y2] in pixels", example = "[206, 176, 226, 196]"))
        @NotNull @Size(min = 4, max = 4) List<@NotNull Double> bbox) {
}
