package com.capacitylens.quality.validation;

import com.capacitylens.quality.model.DataStatistics;

/**
 * Scores shared by step execution and validation. All percentages are on a 0-100 scale.
 */
public final class QualityScoring {

    private static final int COMFORTABLE_POINT_COUNT = 30;

    private QualityScoring() {
    }

    public static double outlierReduction(DataStatistics original, DataStatistics processed) {
        return original.outlierPercentage() - processed.outlierPercentage();
    }

    public static double varianceReduction(DataStatistics original, DataStatistics processed) {
        if (original.stdDev() == 0) {
            return 0d;
        }
        return (original.stdDev() - processed.stdDev()) / original.stdDev() * 100;
    }

    public static double stepImprovement(DataStatistics original, DataStatistics processed) {
        double outlierImprovement = Math.max(0d, outlierReduction(original, processed));
        double varianceImprovement = Math.max(0d, varianceReduction(original, processed));
        return clamp(outlierImprovement * 2 + varianceImprovement * 0.5);
    }

    public static double normalityImprovement(DataStatistics original, DataStatistics processed) {
        double skewnessImprovement = Math.max(0d, Math.abs(original.skewness()) - Math.abs(processed.skewness()));
        double kurtosisImprovement = Math.max(0d, Math.abs(original.kurtosis() - 3) - Math.abs(processed.kurtosis() - 3));
        return skewnessImprovement * 30 + kurtosisImprovement * 20;
    }

    public static double dataQualityScore(DataStatistics statistics) {
        double score = 100d;
        score -= statistics.outlierPercentage() * 2;
        score -= Math.abs(statistics.skewness()) * 5;
        score -= Math.abs(statistics.kurtosis() - 3) * 3;
        if (statistics.count() < COMFORTABLE_POINT_COUNT) {
            score -= (COMFORTABLE_POINT_COUNT - statistics.count()) * 2;
        }
        return clamp(score);
    }

    private static double clamp(double value) {
        return Math.max(0d, Math.min(100d, value));
    }
}
