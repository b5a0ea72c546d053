package com.example.harborwatch.config;

import com.example.harborwatch.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationConfigurationTest {

    private final CorrelationConfiguration configuration = new CorrelationConfiguration();

    @Test
    void rejectsZeroTolerance() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.setToleranceMeters(0);

        assertThatThrownBy(() -> configuration.calibrationFrameCatalog(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("harbor-watch.tolerance-meters");
    }

    @Test
    void rejectsNegativeTolerance() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.setToleranceMeters(-1);

        assertThatThrownBy(() -> configuration.calibrationFrameCatalog(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void acceptsPositiveToleranceWithoutFrames() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.setToleranceMeters(250);

        CalibrationFrameCatalog catalog = configuration.calibrationFrameCatalog(properties);

        assertThat(catalog.frames()).isEmpty();
        assertThat(catalog.hasDefault()).isFalse();
    }
}
