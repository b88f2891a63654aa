package com.capacitylens.quality.model;

/**
 * Descriptive snapshot of a series. Outliers are counted with the 1.5×IQR rule and
 * {@code kurtosis} is excess kurtosis.
 */
public record DataStatistics(
        int count,
        double mean,
        double median,
        double stdDev,
        double min,
        double max,
        int outlierCount,
        double outlierPercentage,
        double skewness,
        double kurtosis
) {
}
