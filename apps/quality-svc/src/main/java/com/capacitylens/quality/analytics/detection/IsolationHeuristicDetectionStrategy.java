package com.capacitylens.quality.analytics.detection;

import com.capacitylens.quality.analytics.SeriesStatistics;
import com.capacitylens.quality.analytics.SeverityClassifier;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import com.capacitylens.quality.model.OutlierPoint;
import com.capacitylens.quality.model.Sensitivity;
import com.capacitylens.quality.model.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Isolation-style heuristic: a point scores high when its nearest neighbours are far away
 * relative to the spread of the whole series. This is not an isolation forest and carries
 * none of its statistical guarantees. Cost is O(n²) in the series length.
 */
@Component
public class IsolationHeuristicDetectionStrategy implements DetectionStrategy {

    // score distance is reported in hundredths when classifying severity
    private static final double SEVERITY_SCALE = 0.01d;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ISOLATION_HEURISTIC;
    }

    @Override
    public DetectionOutcome detect(List<DataPoint> series, DetectionConfig config) {
        double[] values = SeriesStatistics.values(series);
        double[] scores = isolationScores(values);
        double threshold = config.thresholdOverride().orElseGet(() -> thresholdFor(config.sensitivity()));
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values, mean);

        List<OutlierPoint> outliers = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double score = scores[i];
            if (score <= threshold) {
                continue;
            }
            DataPoint point = series.get(i);
            double zScore = SeriesStatistics.zScore(point.value(), mean, stdDev);
            double distance = score - threshold;
            Severity severity = SeverityClassifier.classify(zScore, distance, SEVERITY_SCALE);
            outliers.add(new OutlierPoint(
                    i,
                    point.value(),
                    point.timestamp(),
                    zScore,
                    severity,
                    String.format(Locale.ROOT, "Isolation score of %.3f indicates anomalous behavior", score),
                    SeverityClassifier.suggestedAction(severity),
                    distance));
        }
        return new DetectionOutcome(outliers, threshold);
    }

    static double[] isolationScores(double[] values) {
        int n = values.length;
        double[] scores = new double[n];
        if (n < 2) {
            return scores;
        }
        double[] sorted = SeriesStatistics.sorted(values);
        double maxPairwiseDistance = sorted[n - 1] - sorted[0];
        if (maxPairwiseDistance == 0) {
            return scores;
        }
        int k = Math.min(Math.max(3, (int) Math.floor(Math.sqrt(n))), n - 1);
        double[] distances = new double[n - 1];
        for (int i = 0; i < n; i++) {
            int cursor = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    distances[cursor++] = Math.abs(values[j] - values[i]);
                }
            }
            Arrays.sort(distances);
            double sum = 0d;
            for (int m = 0; m < k; m++) {
                sum += distances[m];
            }
            scores[i] = (sum / k) / maxPairwiseDistance;
        }
        return scores;
    }

    static double thresholdFor(Sensitivity sensitivity) {
        return switch (sensitivity) {
            case LOW -> 0.7;
            case MEDIUM -> 0.6;
            case HIGH -> 0.5;
        };
    }
}
