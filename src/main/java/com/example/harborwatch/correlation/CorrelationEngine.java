package com.example.harborwatch.correlation;

import com.example.harborwatch.exception.ConfigurationException;
import com.example.harborwatch.geo.CoordinateTransform;
import com.example.harborwatch.geo.DistanceMetric;
import com.example.harborwatch.model.CalibrationFrame;
import com.example.harborwatch.model.Detection;
import com.example.harborwatch.model.GeoPoint;
import com.example.harborwatch.model.MatchResult;
import com.example.harborwatch.model.RegistryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Correlates detections with registry entries. Every detection is geolocated
 * through the calibration frame and matched to the closest registry entry
 * within the tolerance radius (inclusive). Exact distance ties go to the
 * entry with the lowest identifier, so the outcome never depends on the order
 * in which the registry was supplied.
 * <p>
 * Each result depends only on its own detection and the read-only registry, so
 * detections may be processed in parallel. Results are always returned in the
 * order of the input detections.
 */
@Component
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private static final Comparator<RegistryEntry> CANDIDATE_ORDER = Comparator
            .comparing(RegistryEntry::id, RegistryIdComparator.INSTANCE)
            .thenComparing(RegistryEntry::name, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingDouble(entry -> entry.position().lat())
            .thenComparingDouble(entry -> entry.position().lon());

    private final DistanceMetric distanceMetric;

    public CorrelationEngine(DistanceMetric distanceMetric) {
        this.distanceMetric = Objects.requireNonNull(distanceMetric, "distanceMetric");
    }

    public List<MatchResult> correlate(List<Detection> detections,
                                       Collection<RegistryEntry> registry,
                                       CalibrationFrame frame,
                                       double toleranceMeters) {
        return correlate(detections, registry, frame, toleranceMeters, false);
    }

    public List<MatchResult> correlate(List<Detection> detections,
                                       Collection<RegistryEntry> registry,
                                       CalibrationFrame frame,
                                       double toleranceMeters,
                                       boolean parallel) {
        if (frame == null) {
            throw new ConfigurationException("A calibration frame is required for a correlation pass");
        }
        if (!Double.isFinite(toleranceMeters) || toleranceMeters <= 0) {
            throw new ConfigurationException("Tolerance radius must be a positive number of meters but was " + toleranceMeters);
        }
        Objects.requireNonNull(detections, "detections");

        List<RegistryEntry> candidates = candidates(registry);
        IntStream indices = IntStream.range(0, detections.size());
        if (parallel) {
            indices = indices.parallel();
        }
        List<MatchResult> results = indices
                .mapToObj(i -> correlateOne(detections.get(i), candidates, frame, toleranceMeters))
                .collect(Collectors.toList());
        log.debug("Correlated {} detections against {} registry entries (tolerance {} m, parallel {})",
                results.size(), candidates.size(), toleranceMeters, parallel);
        return results;
    }

    private MatchResult correlateOne(Detection detection,
                                     List<RegistryEntry> candidates,
                                     CalibrationFrame frame,
                                     double toleranceMeters) {
        GeoPoint derived = CoordinateTransform.pixelToGeo(detection.centerPixel(), frame);
        RegistryEntry best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        // candidates are sorted by id, so strict comparison keeps the lowest id on ties
        for (RegistryEntry entry : candidates) {
            double distance = distanceMetric.greatCircleDistanceMeters(derived, entry.position());
            if (distance <= toleranceMeters && distance < bestDistance) {
                best = entry;
                bestDistance = distance;
            }
        }
        if (best == null) {
            return MatchResult.dark(detection, derived);
        }
        return MatchResult.legal(detection, derived, best, bestDistance);
    }

    private List<RegistryEntry> candidates(Collection<RegistryEntry> registry) {
        if (registry == null || registry.isEmpty()) {
            return List.of();
        }
        return registry.stream()
                .filter(Objects::nonNull)
                .filter(this::hasUsablePosition)
                .sorted(CANDIDATE_ORDER)
                .collect(Collectors.toUnmodifiableList());
    }

    private boolean hasUsablePosition(RegistryEntry entry) {
        GeoPoint position = entry.position();
        if (Double.isFinite(position.lat()) && Double.isFinite(position.lon())) {
            return true;
        }
        log.warn("Excluding registry entry {} with unusable position {}", entry.id(), position);
        return false;
    }
}
