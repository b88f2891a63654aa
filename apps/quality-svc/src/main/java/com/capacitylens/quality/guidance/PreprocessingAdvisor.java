package com.capacitylens.quality.guidance;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.OutlierPoint;
import com.capacitylens.quality.model.PreprocessingSuggestion;
import com.capacitylens.quality.model.StrategyType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Proposes remediation strategies for a detection result, ranked by applicability.
 */
@Service
public class PreprocessingAdvisor {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingAdvisor.class);

    private static final double TRANSFORMATION_MIN_OUTLIER_PERCENTAGE = 10d;

    private final GuidancePolicy policy;

    public PreprocessingAdvisor(GuidancePolicy policy) {
        this.policy = policy;
    }

    /**
     * Fixed-score suggestions, derived from the detection result alone.
     */
    public List<PreprocessingSuggestion> suggestPreprocessing(DetectionResult result) {
        requireResult(result);
        return build(result, result.statistics().totalPoints(), GuidancePolicy.simple());
    }

    public List<PreprocessingSuggestion> generateSuggestions(DetectionResult result, List<DataPoint> series) {
        return generateSuggestions(result, series, policy);
    }

    public List<PreprocessingSuggestion> generateSuggestions(DetectionResult result, List<DataPoint> series, GuidancePolicy guidancePolicy) {
        requireResult(result);
        if (series == null) {
            throw new IllegalArgumentException("series must be provided");
        }
        return build(result, series.size(), guidancePolicy);
    }

    private List<PreprocessingSuggestion> build(DetectionResult result, int seriesLength, GuidancePolicy guidancePolicy) {
        DetectionResult.Statistics statistics = result.statistics();
        List<Integer> outlierIndices = result.outliers().stream()
                .map(OutlierPoint::index)
                .toList();

        List<PreprocessingSuggestion> suggestions = new ArrayList<>();
        if (guidancePolicy.allowsRemoval(statistics.outlierPercentage())) {
            suggestions.add(removal(statistics, outlierIndices, seriesLength, guidancePolicy));
        }
        suggestions.add(imputation(statistics, outlierIndices, guidancePolicy));
        if (statistics.severityBreakdown().extremeCount() > 0) {
            suggestions.add(capping(statistics, guidancePolicy));
        }
        if (statistics.outlierPercentage() > TRANSFORMATION_MIN_OUTLIER_PERCENTAGE) {
            suggestions.add(transformation(statistics, guidancePolicy));
        }

        suggestions.sort(Comparator.comparingDouble(PreprocessingSuggestion::applicability).reversed()
                .thenComparingInt(suggestion -> guidancePolicy.preferenceRank(suggestion.type())));
        log.debug("Preprocessing suggestions: preset={} outlierPercentage={} offered={}",
                guidancePolicy.scoring(), statistics.outlierPercentage(),
                suggestions.stream().map(PreprocessingSuggestion::id).toList());
        return List.copyOf(suggestions);
    }

    private PreprocessingSuggestion removal(DetectionResult.Statistics statistics, List<Integer> outlierIndices, int seriesLength, GuidancePolicy guidancePolicy) {
        int remaining = seriesLength - statistics.outlierCount();
        List<String> cons = new ArrayList<>(List.of(
                "Permanent loss of potentially valid data",
                String.format(Locale.ROOT, "Reduces dataset size by %.1f%%", statistics.outlierPercentage()),
                "May remove important extreme events or rare occurrences",
                "Could introduce bias if outliers are legitimate values"
        ));
        if (remaining < guidancePolicy.minDataPointsRequired()) {
            cons.add("Leaves " + remaining + " points, below the " + guidancePolicy.minDataPointsRequired() + "-point minimum for reliable forecasting");
        }
        return new PreprocessingSuggestion(
                StrategyType.REMOVAL.label(),
                StrategyType.REMOVAL,
                "Remove Outlier Data Points",
                "Remove " + statistics.outlierCount() + " detected outlier points from the dataset. "
                        + "This is recommended when outliers represent data errors or anomalies.",
                List.of(
                        "Simple and straightforward approach",
                        "Completely eliminates problematic data points",
                        "Improves model stability and reduces noise",
                        "Prevents outliers from skewing analysis results"
                ),
                List.copyOf(cons),
                ApplicabilityScorer.score(StrategyType.REMOVAL, statistics, guidancePolicy.scoring()),
                new PreprocessingSuggestion.Implementation(
                        "filter",
                        Map.of(
                                "removeIndices", outlierIndices,
                                "outlierCount", statistics.outlierCount()
                        ),
                        String.format(Locale.ROOT, "Dataset will be reduced from %d to %d points (%.1f%% reduction)",
                                seriesLength, remaining, statistics.outlierPercentage())
                )
        );
    }

    private PreprocessingSuggestion imputation(DetectionResult.Statistics statistics, List<Integer> outlierIndices, GuidancePolicy guidancePolicy) {
        return new PreprocessingSuggestion(
                StrategyType.IMPUTATION.label(),
                StrategyType.IMPUTATION,
                "Replace Outliers with Interpolated Values",
                "Replace " + statistics.outlierCount() + " outliers with statistically derived values "
                        + "using interpolation or mean/median substitution.",
                List.of(
                        "Preserves dataset size and structure",
                        "Maintains temporal continuity in time series",
                        "Less aggressive than complete removal",
                        "Reduces impact of extreme values while keeping data points"
                ),
                List.of(
                        "May introduce artificial patterns or smoothing",
                        "Reduces natural data variance and volatility",
                        "Requires careful selection of imputation method",
                        "Could mask legitimate extreme events"
                ),
                ApplicabilityScorer.score(StrategyType.IMPUTATION, statistics, guidancePolicy.scoring()),
                new PreprocessingSuggestion.Implementation(
                        "interpolation",
                        Map.of(
                                "method", "linear",
                                "outlierIndices", outlierIndices,
                                "fallbackMethod", "median"
                        ),
                        statistics.outlierCount() + " outlier values will be replaced with interpolated values based on surrounding data points"
                )
        );
    }

    private PreprocessingSuggestion capping(DetectionResult.Statistics statistics, GuidancePolicy guidancePolicy) {
        int extremeCount = statistics.severityBreakdown().extremeCount();
        Aggressiveness aggressiveness = guidancePolicy.scoring() == ScoringPreset.SIMPLE
                ? Aggressiveness.MODERATE
                : guidancePolicy.aggressiveness();
        int lower = aggressiveness.lowerPercentile();
        int upper = aggressiveness.upperPercentile();
        return new PreprocessingSuggestion(
                StrategyType.CAPPING.label(),
                StrategyType.CAPPING,
                "Cap Extreme Values (Winsorization)",
                "Limit outlier values to threshold boundaries. " + extremeCount
                        + " extreme outliers will be capped to acceptable ranges.",
                List.of(
                        "Preserves all data points in the dataset",
                        "Reduces impact of extreme values on analysis",
                        "Maintains overall dataset structure and size",
                        "Balances between removal and keeping original data"
                ),
                List.of(
                        "Distorts the original data distribution",
                        "May hide important signals or trends",
                        "Threshold selection can be somewhat arbitrary",
                        "Changes the actual values in the dataset"
                ),
                ApplicabilityScorer.score(StrategyType.CAPPING, statistics, guidancePolicy.scoring()),
                new PreprocessingSuggestion.Implementation(
                        "winsorize",
                        Map.of(
                                "lowerPercentile", lower,
                                "upperPercentile", upper,
                                "affectedOutliers", extremeCount
                        ),
                        "Values below " + ordinal(lower) + " percentile and above " + ordinal(upper)
                                + " percentile will be capped to those thresholds"
                )
        );
    }

    private PreprocessingSuggestion transformation(DetectionResult.Statistics statistics, GuidancePolicy guidancePolicy) {
        return new PreprocessingSuggestion(
                StrategyType.TRANSFORMATION.label(),
                StrategyType.TRANSFORMATION,
                "Apply Mathematical Transformation",
                "Transform data using logarithmic or other mathematical functions to reduce outlier impact. "
                        + "Recommended when outliers represent natural data skewness.",
                List.of(
                        "Preserves all original data points",
                        "Can normalize skewed distributions",
                        "Reduces impact of outliers naturally",
                        "Often improves model performance"
                ),
                List.of(
                        "Changes the scale and interpretation of data",
                        "May complicate result interpretation",
                        "Requires inverse transformation for forecasts",
                        "Not suitable for all data types"
                ),
                ApplicabilityScorer.score(StrategyType.TRANSFORMATION, statistics, guidancePolicy.scoring()),
                new PreprocessingSuggestion.Implementation(
                        "log_transform",
                        Map.of(
                                "transformation", "log1p",
                                "handleNegatives", true
                        ),
                        "Data will be log-transformed to reduce skewness and outlier impact"
                )
        );
    }

    private static String ordinal(int value) {
        int mod100 = value % 100;
        if (mod100 >= 11 && mod100 <= 13) {
            return value + "th";
        }
        return switch (value % 10) {
            case 1 -> value + "st";
            case 2 -> value + "nd";
            case 3 -> value + "rd";
            default -> value + "th";
        };
    }

    private static void requireResult(DetectionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("detection result must be provided");
        }
    }
}
