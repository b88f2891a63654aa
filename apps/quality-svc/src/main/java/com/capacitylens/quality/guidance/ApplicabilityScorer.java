package com.capacitylens.quality.guidance;

import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.StrategyType;

/**
 * Single scoring function behind both suggestion generators. Results are always in [0,1].
 */
public final class ApplicabilityScorer {

    private ApplicabilityScorer() {
    }

    public static double score(StrategyType type, DetectionResult.Statistics statistics, ScoringPreset preset) {
        double score = preset == ScoringPreset.SIMPLE
                ? simpleScore(type)
                : policyScore(type, statistics);
        return Math.max(0d, Math.min(1d, score));
    }

    private static double simpleScore(StrategyType type) {
        return switch (type) {
            case REMOVAL -> 0.8;
            case IMPUTATION -> 0.7;
            case CAPPING -> 0.75;
            case TRANSFORMATION -> 0.65;
        };
    }

    private static double policyScore(StrategyType type, DetectionResult.Statistics statistics) {
        double outlierPercentage = statistics.outlierPercentage();
        return switch (type) {
            case REMOVAL -> {
                if (outlierPercentage < 2) yield 0.9;
                if (outlierPercentage < 5) yield 0.7;
                if (outlierPercentage < 10) yield 0.4;
                yield 0.2;
            }
            case IMPUTATION -> {
                if (outlierPercentage < 10) yield 0.8;
                if (outlierPercentage < 20) yield 0.6;
                yield 0.4;
            }
            case CAPPING -> {
                double extremePercentage = statistics.totalPoints() == 0
                        ? 0d
                        : statistics.severityBreakdown().extremeCount() * 100.0 / statistics.totalPoints();
                if (extremePercentage > 5) yield 0.9;
                if (extremePercentage > 2) yield 0.75;
                yield 0.6;
            }
            case TRANSFORMATION -> {
                if (outlierPercentage > 20) yield 0.8;
                if (outlierPercentage > 15) yield 0.65;
                if (outlierPercentage > 10) yield 0.5;
                yield 0.3;
            }
        };
    }
}
