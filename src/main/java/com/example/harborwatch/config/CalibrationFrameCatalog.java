package com.example.harborwatch.config;

import com.example.harborwatch.exception.ConfigurationException;
import com.example.harborwatch.exception.UnknownFrameException;
import com.example.harborwatch.model.CalibrationFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named calibration frames, one per imagery source, ordered by name. Frames
 * are validated when the catalog is built so that a malformed deployment fails
 * at startup.
 */
public class CalibrationFrameCatalog {

    private final Map<String, CalibrationFrame> frames;
    private final String defaultFrameName;

    public CalibrationFrameCatalog(Map<String, CalibrationFrame> frames, String defaultFrameName) {
        this.frames = Collections.unmodifiableMap(new TreeMap<>(frames));
        if (defaultFrameName != null && !defaultFrameName.isBlank() && !this.frames.containsKey(defaultFrameName)) {
            throw new ConfigurationException("Default calibration frame '" + defaultFrameName + "' is not configured");
        }
        this.defaultFrameName = defaultFrameName == null || defaultFrameName.isBlank() ? null : defaultFrameName;
    }

    public static CalibrationFrameCatalog fromProperties(HarborWatchProperties properties) {
        Map<String, CalibrationFrame> frames = new LinkedHashMap<>();
        properties.getFrames().forEach((name, frame) -> {
            try {
                frames.put(name, new CalibrationFrame(frame.getNorth(), frame.getSouth(), frame.getWest(),
                        frame.getEast(), frame.getImageWidth(), frame.getImageHeight()));
            } catch (ConfigurationException ex) {
                throw new ConfigurationException("Calibration frame '" + name + "' is invalid: " + ex.getMessage());
            }
        });
        return new CalibrationFrameCatalog(frames, properties.getDefaultFrame());
    }

    public CalibrationFrame resolve(String name) {
        CalibrationFrame frame = frames.get(name);
        if (frame == null) {
            throw new UnknownFrameException(name);
        }
        return frame;
    }

    public String defaultFrameName() {
        if (defaultFrameName == null) {
            throw new ConfigurationException("No calibration frame was requested and no default frame is configured");
        }
        return defaultFrameName;
    }

    public boolean hasDefault() {
        return defaultFrameName != null;
    }

    public Map<String, CalibrationFrame> frames() {
        return frames;
    }
}
