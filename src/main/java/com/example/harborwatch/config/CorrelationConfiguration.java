package com.example.harborwatch.config;

import com.example.harborwatch.exception.ConfigurationException;
import com.example.harborwatch.geo.DistanceMetric;
import com.example.harborwatch.geo.HaversineDistanceMetric;
import com.example.harborwatch.registry.RegistryRecordResolver;
import com.example.harborwatch.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the correlation core from {@link HarborWatchProperties}. Every check
 * here runs at startup so a misconfigured deployment never serves a pass.
 */
@Configuration
public class CorrelationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CorrelationConfiguration.class);

    @Bean
    public DistanceMetric distanceMetric() {
        return new HaversineDistanceMetric();
    }

    @Bean
    public CalibrationFrameCatalog calibrationFrameCatalog(HarborWatchProperties properties) {
        if (!Double.isFinite(properties.getToleranceMeters()) || properties.getToleranceMeters() <= 0) {
            throw new ConfigurationException(
                    "harbor-watch.tolerance-meters must be positive but was " + properties.getToleranceMeters());
        }
        CalibrationFrameCatalog catalog = CalibrationFrameCatalog.fromProperties(properties);
        log.info("Loaded {} calibration frame(s) {}; default frame: {}; tolerance {} m",
                catalog.frames().size(), catalog.frames().keySet(),
                catalog.hasDefault() ? catalog.defaultFrameName() : "none", properties.getToleranceMeters());
        return catalog;
    }

    @Bean
    public RegistrySnapshot configuredRegistry(HarborWatchProperties properties, RegistryRecordResolver resolver) {
        RegistrySnapshot snapshot = resolver.resolveAll(properties.getRegistry());
        if (snapshot.entries().isEmpty()) {
            log.info("No default registry configured; requests must supply their own registry records");
        } else {
            log.info("Loaded default registry with {} entries ({} records skipped)",
                    snapshot.entries().size(), snapshot.skipped().size());
        }
        return snapshot;
    }
}
