package com.example.harborwatch.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of correlating one detection against the registry. A LEGAL result
 * always carries the matched entry and its distance; a DARK result carries
 * neither.
 */
public record MatchResult(
        Detection detection,
        GeoPoint derivedPosition,
        RegistryEntry matchedEntry,
        Double distanceMeters,
        MatchStatus status) {

    public MatchResult {
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(derivedPosition, "derivedPosition");
        Objects.requireNonNull(status, "status");
        if ((matchedEntry == null) != (distanceMeters == null)) {
            throw new IllegalArgumentException("Matched entry and distance must be present together");
        }
        if ((status == MatchStatus.LEGAL) != (matchedEntry != null)) {
            throw new IllegalArgumentException("Status " + status + " is inconsistent with the matched entry");
        }
    }

    public static MatchResult legal(Detection detection, GeoPoint derivedPosition, RegistryEntry entry, double distanceMeters) {
        return new MatchResult(detection, derivedPosition, entry, distanceMeters, MatchStatus.LEGAL);
    }

    public static MatchResult dark(Detection detection, GeoPoint derivedPosition) {
        return new MatchResult(detection, derivedPosition, null, null, MatchStatus.DARK);
    }

    public Optional<RegistryEntry> match() {
        return Optional.ofNullable(matchedEntry);
    }
}
