package com.capacitylens.quality.model;

import java.util.List;

public record ValidationReport(
        boolean valid,
        Improvements improvements,
        List<String> concerns,
        List<String> recommendations,
        Snapshot statistics
) {
    public record Improvements(
            double outlierReduction,
            double varianceReduction,
            double normalityImprovement,
            double dataQualityScore
    ) {
    }

    public record Snapshot(DataStatistics original, DataStatistics processed) {
    }
}
