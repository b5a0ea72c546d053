package com.example.harborwatch.service;

import com.example.harborwatch.model.CalibrationFrame;
import com.example.harborwatch.model.Detection;

import java.util.List;
import java.util.Map;

/**
 * Inputs of one correlation pass. Optional parts fall back to configuration:
 * an inline {@code calibration} wins over {@code frameName}, which wins over
 * the configured default frame; a {@code null} tolerance uses the configured
 * radius; {@code null} registry records use the configured registry.
 */
public record CorrelationCommand(
        String frameName,
        CalibrationFrame calibration,
        Double toleranceMeters,
        List<Detection> detections,
        List<Map<String, Object>> registryRecords) {

    public CorrelationCommand {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
