package com.capacitylens.quality.analytics;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DataStatistics;
import com.capacitylens.quality.model.DetectionResult;
import java.util.Arrays;
import java.util.List;

/**
 * Population statistics over series values. Empty input yields zeros instead of NaN.
 */
public final class SeriesStatistics {

    public static final double IQR_MULTIPLIER = 1.5d;

    private SeriesStatistics() {
    }

    public static double[] values(List<DataPoint> series) {
        return series.stream().mapToDouble(DataPoint::value).toArray();
    }

    public static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0d;
        }
        double sumSquares = 0d;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    public static double zScore(double value, double mean, double stdDev) {
        return stdDev == 0 ? 0d : (value - mean) / stdDev;
    }

    /**
     * Linearly interpolated percentile over already sorted values.
     */
    public static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    public static double median(double[] values) {
        return percentile(sorted(values), 50);
    }

    public static DetectionResult.Thresholds iqrBounds(double[] sortedValues, double multiplier) {
        double q1 = percentile(sortedValues, 25);
        double q3 = percentile(sortedValues, 75);
        double iqr = q3 - q1;
        return new DetectionResult.Thresholds(q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    public static double skewness(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (stdDev == 0 || n < 3) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += Math.pow((value - mean) / stdDev, 3);
        }
        return ((double) n / ((n - 1d) * (n - 2d))) * sum;
    }

    /**
     * Bias-corrected excess kurtosis; a normal distribution scores close to 0.
     */
    public static double excessKurtosis(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (stdDev == 0 || n < 4) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += Math.pow((value - mean) / stdDev, 4);
        }
        double kurtosis = (n * (n + 1d)) / ((n - 1d) * (n - 2d) * (n - 3d)) * sum;
        double correction = 3 * Math.pow(n - 1d, 2) / ((n - 2d) * (n - 3d));
        return kurtosis - correction;
    }

    public static DataStatistics describe(List<DataPoint> series) {
        double[] values = values(series);
        double[] sorted = sorted(values);
        double mean = mean(values);
        double stdDev = stdDev(values, mean);
        DetectionResult.Thresholds bounds = iqrBounds(sorted, IQR_MULTIPLIER);
        int outlierCount = (int) Arrays.stream(values)
                .filter(value -> value < bounds.lower() || value > bounds.upper())
                .count();
        int count = values.length;
        return new DataStatistics(
                count,
                mean,
                percentile(sorted, 50),
                stdDev,
                count == 0 ? 0d : sorted[0],
                count == 0 ? 0d : sorted[count - 1],
                outlierCount,
                count == 0 ? 0d : outlierCount * 100.0 / count,
                skewness(values, mean, stdDev),
                excessKurtosis(values, mean, stdDev)
        );
    }
}
