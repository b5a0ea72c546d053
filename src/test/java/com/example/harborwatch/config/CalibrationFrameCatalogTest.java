package com.example.harborwatch.config;

import com.example.harborwatch.exception.ConfigurationException;
import com.example.harborwatch.exception.UnknownFrameException;
import com.example.harborwatch.model.CalibrationFrame;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalibrationFrameCatalogTest {

    @Test
    void buildsFramesFromProperties() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.getFrames().put("western-harbour", frame(31.202, 31.168, 29.855, 29.885, 1178, 665));
        properties.setDefaultFrame("western-harbour");

        CalibrationFrameCatalog catalog = CalibrationFrameCatalog.fromProperties(properties);

        assertThat(catalog.defaultFrameName()).isEqualTo("western-harbour");
        assertThat(catalog.resolve("western-harbour"))
                .isEqualTo(new CalibrationFrame(31.202, 31.168, 29.855, 29.885, 1178, 665));
    }

    @Test
    void failsFastOnInvalidFrame() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.getFrames().put("broken", frame(31.202, 31.168, 29.855, 29.885, 0, 665));

        assertThatThrownBy(() -> CalibrationFrameCatalog.fromProperties(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void failsFastWhenDefaultFrameIsMissing() {
        HarborWatchProperties properties = new HarborWatchProperties();
        properties.setDefaultFrame("nowhere");

        assertThatThrownBy(() -> CalibrationFrameCatalog.fromProperties(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    void reportsUnknownFrames() {
        CalibrationFrameCatalog catalog = new CalibrationFrameCatalog(Map.of(), null);

        assertThat(catalog.hasDefault()).isFalse();
        assertThatThrownBy(() -> catalog.resolve("port-said"))
                .isInstanceOf(UnknownFrameException.class)
                .hasMessageContaining("port-said");
        assertThatThrownBy(catalog::defaultFrameName)
                .isInstanceOf(ConfigurationException.class);
    }

    private static HarborWatchProperties.FrameProperties frame(double north, double south, double west, double east,
                                                               int width, int height) {
        HarborWatchProperties.FrameProperties frame = new HarborWatchProperties.FrameProperties();
        frame.setNorth(north);
        frame.setSouth(south);
        frame.setWest(west);
        frame.setEast(east);
        frame.setImageWidth(width);
        frame.setImageHeight(height);
        return frame;
    }
}
