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
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class ZScoreDetectionStrategy implements DetectionStrategy {

    @Override
    public DetectionMethod method() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public DetectionOutcome detect(List<DataPoint> series, DetectionConfig config) {
        double[] values = SeriesStatistics.values(series);
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values, mean);
        double threshold = config.thresholdOverride().orElseGet(() -> thresholdFor(config.sensitivity()));

        List<OutlierPoint> outliers = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            DataPoint point = series.get(i);
            double zScore = Math.abs(SeriesStatistics.zScore(point.value(), mean, stdDev));
            if (zScore <= threshold) {
                continue;
            }
            double distance = (zScore - threshold) * stdDev;
            Severity severity = SeverityClassifier.classify(zScore, distance, stdDev);
            outliers.add(new OutlierPoint(
                    i,
                    point.value(),
                    point.timestamp(),
                    zScore,
                    severity,
                    String.format(Locale.ROOT, "Z-score of %.2f exceeds threshold of %.2f", zScore, threshold),
                    SeverityClassifier.suggestedAction(severity),
                    distance));
        }
        return new DetectionOutcome(outliers, threshold);
    }

    static double thresholdFor(Sensitivity sensitivity) {
        return switch (sensitivity) {
            case LOW -> 3.5;
            case MEDIUM -> 3.0;
            case HIGH -> 2.5;
        };
    }
}
