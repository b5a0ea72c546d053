package com.example.harborwatch.registry;

import com.example.harborwatch.model.RegistryEntry;
import com.example.harborwatch.model.SkippedRecord;

import java.util.List;

/**
 * Immutable registry view used for one correlation pass, together with the
 * records that were dropped while building it.
 */
public record RegistrySnapshot(List<RegistryEntry> entries, List<SkippedRecord> skipped) {

    public RegistrySnapshot {
        entries = List.copyOf(entries);
        skipped = List.copyOf(skipped);
    }
}
