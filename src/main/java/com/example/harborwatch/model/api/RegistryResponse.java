package com.example.harborwatch.model.api;

import com.example.harborwatch.model.RegistryEntry;
import com.example.harborwatch.model.SkippedRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Configured vessel registry")
public record RegistryResponse(
        @Schema(description = "Entries taking part in correlation") List<RegistryEntry> entries,
        @Schema(description = "Configured records that could not be resolved") List<SkippedRecord> skipped) {
}
