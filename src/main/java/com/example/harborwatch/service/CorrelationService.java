package com.example.harborwatch.service;

import com.example.harborwatch.classification.ClassificationPolicy;
import com.example.harborwatch.config.CalibrationFrameCatalog;
import com.example.harborwatch.config.HarborWatchProperties;
import com.example.harborwatch.correlation.CorrelationEngine;
import com.example.harborwatch.geo.CoordinateTransform;
import com.example.harborwatch.model.CalibrationFrame;
import com.example.harborwatch.model.ClassifiedTarget;
import com.example.harborwatch.model.CorrelationReport;
import com.example.harborwatch.model.MatchResult;
import com.example.harborwatch.registry.RegistryRecordResolver;
import com.example.harborwatch.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class CorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationService.class);

    static final String INLINE_FRAME_NAME = "inline";

    private final HarborWatchProperties properties;
    private final CalibrationFrameCatalog frameCatalog;
    private final RegistrySnapshot configuredRegistry;
    private final RegistryRecordResolver registryResolver;
    private final CorrelationEngine engine;
    private final ClassificationPolicy classificationPolicy;

    public CorrelationService(HarborWatchProperties properties,
                              CalibrationFrameCatalog frameCatalog,
                              RegistrySnapshot configuredRegistry,
                              RegistryRecordResolver registryResolver,
                              CorrelationEngine engine,
                              ClassificationPolicy classificationPolicy) {
        this.properties = properties;
        this.frameCatalog = frameCatalog;
        this.configuredRegistry = configuredRegistry;
        this.registryResolver = registryResolver;
        this.engine = engine;
        this.classificationPolicy = classificationPolicy;
    }

    public CorrelationReport run(CorrelationCommand command) {
        long start = System.nanoTime();

        String frameName;
        CalibrationFrame frame;
        if (command.calibration() != null) {
            frameName = command.frameName() != null && !command.frameName().isBlank() ? command.frameName() : INLINE_FRAME_NAME;
            frame = command.calibration();
        } else {
            frameName = command.frameName() != null && !command.frameName().isBlank()
                    ? command.frameName()
                    : frameCatalog.defaultFrameName();
            frame = frameCatalog.resolve(frameName);
        }
        double tolerance = command.toleranceMeters() != null ? command.toleranceMeters() : properties.getToleranceMeters();
        RegistrySnapshot registry = command.registryRecords() != null
                ? registryResolver.resolveAll(command.registryRecords())
                : configuredRegistry;

        List<MatchResult> results = engine.correlate(
                command.detections(), registry.entries(), frame, tolerance, properties.isParallel());
        List<ClassifiedTarget> targets = results.stream()
                .map(result -> new ClassifiedTarget(result, classificationPolicy.classify(result)))
                .collect(Collectors.toList());

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        CorrelationReport report = new CorrelationReport(
                frameName, frame, tolerance, targets, registry.skipped(), elapsedMs);

        log.info("Fusion pass on frame '{}': {} targets, {} legal, {} dark, {} registry records skipped ({} ms)",
                frameName, targets.size(), report.legalCount(), report.darkCount(), registry.skipped().size(), elapsedMs);
        if (log.isDebugEnabled()) {
            for (ClassifiedTarget target : targets) {
                MatchResult result = target.result();
                log.debug("Detection {} at ({}, {}){} -> {} [{}]",
                        result.detection().id(),
                        result.derivedPosition().lat(),
                        result.derivedPosition().lon(),
                        CoordinateTransform.isInsideImage(result.detection().centerPixel(), frame) ? "" : " off-image",
                        result.status(),
                        target.classification().label());
            }
        }
        return report;
    }

    public RegistrySnapshot configuredRegistry() {
        return configuredRegistry;
    }

    public CalibrationFrameCatalog frameCatalog() {
        return frameCatalog;
    }
}
