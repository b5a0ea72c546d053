package com.example.harborwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "harbor-watch")
public class HarborWatchProperties {

    private double toleranceMeters = 1000.0;
    private boolean parallel = false;
    private String defaultFrame;
    private Map<String, FrameProperties> frames = new LinkedHashMap<>();
    private List<Map<String, Object>> registry = new ArrayList<>();

    public double getToleranceMeters() {
        return toleranceMeters;
    }

    public void setToleranceMeters(double toleranceMeters) {
        this.toleranceMeters = toleranceMeters;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public String getDefaultFrame() {
        return defaultFrame;
    }

    public void setDefaultFrame(String defaultFrame) {
        this.defaultFrame = defaultFrame;
    }

    public Map<String, FrameProperties> getFrames() {
        return frames;
    }

    public void setFrames(Map<String, FrameProperties> frames) {
        this.frames = frames;
    }

    public List<Map<String, Object>> getRegistry() {
        return registry;
    }

    public void setRegistry(List<Map<String, Object>> registry) {
        this.registry = registry;
    }

    /**
     * Geographic bounds and pixel size of one imagery source.
     */
    public static class FrameProperties {

        private double north;
        private double south;
        private double west;
        private double east;
        private int imageWidth;
        private int imageHeight;

        public double getNorth() {
            return north;
        }

        public void setNorth(double north) {
            this.north = north;
        }

        public double getSouth() {
            return south;
        }

        public void setSouth(double south) {
            this.south = south;
        }

        public double getWest() {
            return west;
        }

        public void setWest(double west) {
            this.west = west;
        }

        public double getEast() {
            return east;
        }

        public void setEast(double east) {
            this.east = east;
        }

        public int getImageWidth() {
            return imageWidth;
        }

        public void setImageWidth(int imageWidth) {
            this.imageWidth = imageWidth;
        }

        public int getImageHeight() {
            return imageHeight;
        }

        public void setImageHeight(int imageHeight) {
            this.imageHeight = imageHeight;
        }
    }
}
