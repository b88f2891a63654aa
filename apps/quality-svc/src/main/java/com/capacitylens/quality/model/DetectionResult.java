package com.capacitylens.quality.model;

import java.util.List;
import java.util.Map;

public record DetectionResult(
        List<OutlierPoint> outliers,
        DetectionMethod method,
        double threshold,
        Visualization visualization,
        Statistics statistics,
        String summary
) {
    public record Statistics(
            int totalPoints,
            int outlierCount,
            double outlierPercentage,
            SeverityBreakdown severityBreakdown
    ) {
    }

    public record SeverityBreakdown(int low, int medium, int high, int critical) {

        public static SeverityBreakdown of(List<OutlierPoint> outliers) {
            int[] counts = new int[Severity.values().length];
            for (OutlierPoint outlier : outliers) {
                counts[outlier.severity().ordinal()]++;
            }
            return new SeverityBreakdown(
                    counts[Severity.LOW.ordinal()],
                    counts[Severity.MEDIUM.ordinal()],
                    counts[Severity.HIGH.ordinal()],
                    counts[Severity.CRITICAL.ordinal()]);
        }

        public int count(Severity severity) {
            return switch (severity) {
                case LOW -> low;
                case MEDIUM -> medium;
                case HIGH -> high;
                case CRITICAL -> critical;
            };
        }

        public int extremeCount() {
            return critical + high;
        }
    }

    public record Visualization(
            List<DataPoint> dataPoints,
            List<Integer> outlierIndices,
            Thresholds thresholds,
            Map<Severity, String> highlightColors,
            String normalColor
    ) {
    }

    public record Thresholds(double lower, double upper) {
    }
}
