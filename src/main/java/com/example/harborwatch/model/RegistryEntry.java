package com.example.harborwatch.model;

import java.util.Objects;

/**
 * Trusted record asserting the authorised position of a known vessel.
 *
 * @param id       stable identifier such as an MMSI
 * @param name     display label, {@code null} when the source record carries none
 * @param position reported position
 */
public record RegistryEntry(String id, String name, GeoPoint position) {

    public RegistryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(position, "position");
    }
}
