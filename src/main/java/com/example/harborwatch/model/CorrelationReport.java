package com.example.harborwatch.model;

import java.util.List;

public record CorrelationReport(
        String frameName,
        CalibrationFrame frame,
        double toleranceMeters,
        List<ClassifiedTarget> targets,
        List<SkippedRecord> skippedRecords,
        long elapsedMs) {

    public long legalCount() {
        return targets.stream().filter(target -> target.result().status() == MatchStatus.LEGAL).count();
    }

    public long darkCount() {
        return targets.stream().filter(target -> target.result().status() == MatchStatus.DARK).count();
    }
}
