package com.example.harborwatch.registry;

import com.example.harborwatch.exception.SkippableRecordException;
import com.example.harborwatch.model.GeoPoint;
import com.example.harborwatch.model.RegistryEntry;
import com.example.harborwatch.model.SkippedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns loosely structured registry rows (spreadsheet exports, database rows,
 * JSON payloads) into {@link RegistryEntry} values. Column names differ between
 * sources, so each field is looked up through an ordered alias list and the
 * first key that carries a usable value wins. Keys are compared
 * case-insensitively.
 * <p>
 * A value of {@code 0} is a real value. Only absent, blank, non-numeric or
 * non-finite values count as missing.
 */
@Component
public class RegistryRecordResolver {

    private static final Logger log = LoggerFactory.getLogger(RegistryRecordResolver.class);

    public static final List<String> ID_ALIASES = List.of("ship_id", "mmsi", "id");
    public static final List<String> NAME_ALIASES = List.of("ship_name", "name");
    public static final List<String> LATITUDE_ALIASES = List.of("lat", "latitude");
    public static final List<String> LONGITUDE_ALIASES = List.of("lon", "longitude");

    public RegistryEntry resolve(Map<String, ?> record) throws SkippableRecordException {
        if (record == null || record.isEmpty()) {
            throw new SkippableRecordException("Empty registry record");
        }
        Map<String, Object> normalized = normalizeKeys(record);

        String id = firstText(normalized, ID_ALIASES)
                .orElseThrow(() -> missing("identifier", ID_ALIASES));
        double lat = firstNumber(normalized, LATITUDE_ALIASES)
                .orElseThrow(() -> missing("latitude", LATITUDE_ALIASES));
        double lon = firstNumber(normalized, LONGITUDE_ALIASES)
                .orElseThrow(() -> missing("longitude", LONGITUDE_ALIASES));
        String name = firstText(normalized, NAME_ALIASES).orElse(null);

        return new RegistryEntry(id, name, new GeoPoint(lat, lon));
    }

    public RegistrySnapshot resolveAll(List<? extends Map<String, ?>> records) {
        if (records == null || records.isEmpty()) {
            return new RegistrySnapshot(List.of(), List.of());
        }
        List<RegistryEntry> entries = new ArrayList<>(records.size());
        List<SkippedRecord> skipped = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            try {
                entries.add(resolve(records.get(i)));
            } catch (SkippableRecordException ex) {
                log.warn("Skipping registry record #{}: {}", i, ex.getMessage());
                skipped.add(new SkippedRecord(i, ex.getMessage()));
            }
        }
        log.debug("Resolved {} registry entries ({} skipped)", entries.size(), skipped.size());
        return new RegistrySnapshot(entries, skipped);
    }

    private Map<String, Object> normalizeKeys(Map<String, ?> record) {
        Map<String, Object> normalized = new HashMap<>();
        for (Map.Entry<String, ?> field : record.entrySet()) {
            if (field.getKey() == null) {
                continue;
            }
            String key = field.getKey().trim().toLowerCase(Locale.ROOT);
            normalized.putIfAbsent(key, field.getValue());
        }
        return normalized;
    }

    private Optional<String> firstText(Map<String, Object> record, List<String> aliases) {
        for (String alias : aliases) {
            Optional<String> text = asText(record.get(alias));
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    private Optional<Double> firstNumber(Map<String, Object> record, List<String> aliases) {
        for (String alias : aliases) {
            Optional<Double> number = asNumber(record.get(alias));
            if (number.isPresent()) {
                return number;
            }
        }
        return Optional.empty();
    }

    private Optional<String> asText(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                return Optional.empty();
            }
            // spreadsheet exports turn integer ids into 235000111.0
            return Optional.of(BigDecimal.valueOf(number).stripTrailingZeros().toPlainString());
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private Optional<Double> asNumber(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                number = Double.parseDouble(text);
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(number) ? Optional.of(number) : Optional.empty();
    }

    private SkippableRecordException missing(String field, List<String> aliases) {
        return new SkippableRecordException(
                "No resolvable " + field + " (tried " + String.join(", ", aliases) + ")");
    }
}
