package com.capacitylens.quality.workflow;

import com.capacitylens.quality.analytics.SeriesStatistics;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StrategyType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Replaces target points with values derived from the rest of the series. Every replacement
 * reads the input series, so earlier replacements never feed later ones.
 */
@Component
public class ImputationStrategy extends AbstractPreprocessingStrategy {

    // neighbours beyond this |z| are skipped while interpolating
    private static final double NEIGHBOUR_Z_LIMIT = 3.0;

    public ImputationStrategy(StepParameters stepParameters) {
        super(stepParameters);
    }

    @Override
    public StrategyType type() {
        return StrategyType.IMPUTATION;
    }

    @Override
    protected Transformed transform(List<DataPoint> series, Map<String, Object> parameters) {
        String method = stepParameters.text(parameters, "method", "linear").toLowerCase(Locale.ROOT);
        String fallbackMethod = stepParameters.text(parameters, "fallbackMethod", "median").toLowerCase(Locale.ROOT);
        TreeSet<Integer> targets = new TreeSet<>(stepParameters.indices(parameters, "outlierIndices"));

        double[] values = SeriesStatistics.values(series);
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values, mean);
        double median = SeriesStatistics.median(values);

        List<DataPoint> processed = new ArrayList<>(series);
        int recordsModified = 0;
        for (int index : targets) {
            if (index < 0 || index >= series.size()) {
                continue;
            }
            double imputed = switch (method) {
                case "linear" -> interpolate(values, index, mean, stdDev, fallback(fallbackMethod, mean, median));
                case "mean" -> mean;
                case "median" -> median;
                default -> throw new IllegalArgumentException("Unsupported imputation method: " + method);
            };
            processed.set(index, series.get(index).withValue(imputed));
            recordsModified++;
        }
        return new Transformed(List.copyOf(processed), 0, recordsModified);
    }

    static double interpolate(double[] values, int index, double mean, double stdDev, double fallback) {
        int previous = index - 1;
        while (previous >= 0 && !isUsableNeighbour(values[previous], mean, stdDev)) {
            previous--;
        }
        int next = index + 1;
        while (next < values.length && !isUsableNeighbour(values[next], mean, stdDev)) {
            next++;
        }
        if (previous < 0 && next >= values.length) {
            return fallback;
        }
        if (previous < 0) {
            return values[next];
        }
        if (next >= values.length) {
            return values[previous];
        }
        double weight = (double) (index - previous) / (next - previous);
        return values[previous] * (1 - weight) + values[next] * weight;
    }

    private static boolean isUsableNeighbour(double value, double mean, double stdDev) {
        return Math.abs(SeriesStatistics.zScore(value, mean, stdDev)) <= NEIGHBOUR_Z_LIMIT;
    }

    private static double fallback(String fallbackMethod, double mean, double median) {
        return switch (fallbackMethod) {
            case "median" -> median;
            case "mean" -> mean;
            default -> throw new IllegalArgumentException("Unsupported imputation fallback: " + fallbackMethod);
        };
    }
}
