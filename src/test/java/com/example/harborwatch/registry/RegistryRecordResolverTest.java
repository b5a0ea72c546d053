package com.example.harborwatch.registry;

import com.example.harborwatch.exception.SkippableRecordException;
import com.example.harborwatch.model.RegistryEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryRecordResolverTest {

    private final RegistryRecordResolver resolver = new RegistryRecordResolver();

    @Test
    void resolvesPrimaryColumnNames() throws Exception {
        RegistryEntry entry = resolver.resolve(row(
                "ship_id", 235000111, "ship_name", "ALEX STAR", "lat", 31.1925, "lon", 29.8605));

        assertThat(entry.id()).isEqualTo("235000111");
        assertThat(entry.name()).isEqualTo("ALEX STAR");
        assertThat(entry.position().lat()).isEqualTo(31.1925);
        assertThat(entry.position().lon()).isEqualTo(29.8605);
    }

    @Test
    void fallsBackToAlternateColumnNames() throws Exception {
        RegistryEntry entry = resolver.resolve(row(
                "mmsi", "422000222", "name", "NILE TRADER", "latitude", 31.1820, "longitude", 29.8755));

        assertThat(entry.id()).isEqualTo("422000222");
        assertThat(entry.name()).isEqualTo("NILE TRADER");
        assertThat(entry.position().lat()).isEqualTo(31.1820);
    }

    @Test
    void earlierAliasTakesPrecedence() throws Exception {
        RegistryEntry entry = resolver.resolve(row(
                "mmsi", "999", "ship_id", "1", "latitude", 10.0, "lat", 31.0, "lon", 29.0));

        assertThat(entry.id()).isEqualTo("1");
        assertThat(entry.position().lat()).isEqualTo(31.0);
    }

    @Test
    void keepsZeroAsARealValue() throws Exception {
        RegistryEntry entry = resolver.resolve(row("ship_id", 0, "lat", 0.0, "lon", 0, "latitude", 45.0));

        assertThat(entry.id()).isEqualTo("0");
        assertThat(entry.position().lat()).isZero();
        assertThat(entry.position().lon()).isZero();
    }

    @Test
    void matchesColumnNamesCaseInsensitively() throws Exception {
        RegistryEntry entry = resolver.resolve(row(
                "Ship_ID", 4, "Ship_Name", "MSC Egypt", " Lat ", 31.2185, "LON", 29.8808));

        assertThat(entry.id()).isEqualTo("4");
        assertThat(entry.name()).isEqualTo("MSC Egypt");
    }

    @Test
    void normalizesSpreadsheetStyleNumbers() throws Exception {
        RegistryEntry entry = resolver.resolve(row("mmsi", 235000111.0, "lat", "31.1925", "lon", " 29.8605 "));

        assertThat(entry.id()).isEqualTo("235000111");
        assertThat(entry.position().lat()).isEqualTo(31.1925);
        assertThat(entry.position().lon()).isEqualTo(29.8605);
        assertThat(entry.name()).isNull();
    }

    @Test
    void skipsAliasWithUnusableValueAndTriesTheNextOne() throws Exception {
        RegistryEntry entry = resolver.resolve(row("id", "7", "lat", null, "latitude", 31.19, "lon", "", "longitude", 29.86));

        assertThat(entry.position().lat()).isEqualTo(31.19);
        assertThat(entry.position().lon()).isEqualTo(29.86);
    }

    @Test
    void rejectsRecordWithoutLongitude() {
        assertThatThrownBy(() -> resolver.resolve(row("ship_id", 1, "ship_name", "GHOST", "lat", 31.19)))
                .isInstanceOf(SkippableRecordException.class)
                .hasMessageContaining("longitude");
    }

    @Test
    void treatsNaNAndTextAsMissingCoordinates() {
        assertThatThrownBy(() -> resolver.resolve(row("id", 1, "lat", Double.NaN, "lon", 29.0)))
                .isInstanceOf(SkippableRecordException.class)
                .hasMessageContaining("latitude");
        assertThatThrownBy(() -> resolver.resolve(row("id", 1, "lat", "n/a", "lon", 29.0)))
                .isInstanceOf(SkippableRecordException.class);
    }

    @Test
    void rejectsRecordWithoutIdentifier() {
        assertThatThrownBy(() -> resolver.resolve(row("ship_name", "NO ID", "lat", 31.0, "lon", 29.0)))
                .isInstanceOf(SkippableRecordException.class)
                .hasMessageContaining("identifier");
    }

    @Test
    void resolveAllCollectsSkippedRecordsAndKeepsTheRest() {
        RegistrySnapshot snapshot = resolver.resolveAll(List.of(
                row("ship_id", 1, "ship_name", "ALEX STAR", "lat", 31.1925, "lon", 29.8605),
                row("ship_id", 2, "ship_name", "GHOST", "lat", 31.19),
                row("ship_id", 3, "ship_name", "MED PEARL", "lat", 31.1840, "lon", 29.8810)));

        assertThat(snapshot.entries()).extracting(RegistryEntry::id).containsExactly("1", "3");
        assertThat(snapshot.skipped()).hasSize(1);
        assertThat(snapshot.skipped().get(0).index()).isEqualTo(1);
        assertThat(snapshot.skipped().get(0).reason()).contains("longitude");
    }

    @Test
    void resolveAllAcceptsMissingRegistry() {
        RegistrySnapshot snapshot = resolver.resolveAll(null);

        assertThat(snapshot.entries()).isEmpty();
        assertThat(snapshot.skipped()).isEmpty();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
