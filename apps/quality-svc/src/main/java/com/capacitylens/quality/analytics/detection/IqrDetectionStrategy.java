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
public class IqrDetectionStrategy implements DetectionStrategy {

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }

    @Override
    public DetectionOutcome detect(List<DataPoint> series, DetectionConfig config) {
        double[] values = SeriesStatistics.values(series);
        double[] sorted = SeriesStatistics.sorted(values);
        double q1 = SeriesStatistics.percentile(sorted, 25);
        double q3 = SeriesStatistics.percentile(sorted, 75);
        double iqr = q3 - q1;
        double multiplier = config.thresholdOverride().orElseGet(() -> multiplierFor(config.sensitivity()));
        double threshold = iqr * multiplier;
        double lowerBound = q1 - threshold;
        double upperBound = q3 + threshold;

        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values, mean);

        List<OutlierPoint> outliers = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            DataPoint point = series.get(i);
            double value = point.value();
            if (value >= lowerBound && value <= upperBound) {
                continue;
            }
            double distance = Math.min(Math.abs(value - lowerBound), Math.abs(value - upperBound));
            double zScore = SeriesStatistics.zScore(value, mean, stdDev);
            Severity severity = SeverityClassifier.classify(zScore, distance, iqr);
            String reason = value < lowerBound
                    ? String.format(Locale.ROOT, "Value %.2f is below lower bound %.2f", value, lowerBound)
                    : String.format(Locale.ROOT, "Value %.2f is above upper bound %.2f", value, upperBound);
            outliers.add(new OutlierPoint(
                    i,
                    value,
                    point.timestamp(),
                    zScore,
                    severity,
                    reason,
                    SeverityClassifier.suggestedAction(severity),
                    distance));
        }
        return new DetectionOutcome(outliers, threshold);
    }

    static double multiplierFor(Sensitivity sensitivity) {
        return switch (sensitivity) {
            case LOW -> 3.0;
            case MEDIUM -> 1.5;
            case HIGH -> 1.0;
        };
    }
}
