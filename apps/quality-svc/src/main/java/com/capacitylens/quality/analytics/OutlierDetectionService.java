package com.capacitylens.quality.analytics;

import com.capacitylens.quality.analytics.detection.DetectionOutcome;
import com.capacitylens.quality.analytics.detection.DetectionStrategy;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.OutlierPoint;
import com.capacitylens.quality.model.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OutlierDetectionService {

    private static final Logger log = LoggerFactory.getLogger(OutlierDetectionService.class);

    private static final Map<Severity, String> HIGHLIGHT_COLORS;
    private static final String NORMAL_COLOR = "#3B82F6";

    static {
        Map<Severity, String> colors = new LinkedHashMap<>();
        colors.put(Severity.LOW, "#FFA500");
        colors.put(Severity.MEDIUM, "#FF8C00");
        colors.put(Severity.HIGH, "#FF4500");
        colors.put(Severity.CRITICAL, "#DC143C");
        HIGHLIGHT_COLORS = Collections.unmodifiableMap(colors);
    }

    private final Map<DetectionMethod, DetectionStrategy> strategies = new EnumMap<>(DetectionMethod.class);

    public OutlierDetectionService(List<DetectionStrategy> strategies) {
        for (DetectionStrategy strategy : strategies) {
            this.strategies.put(strategy.method(), strategy);
        }
    }

    public DetectionResult detect(List<DataPoint> series, DetectionConfig config) {
        if (series == null) {
            throw new IllegalArgumentException("series must be provided");
        }
        if (config == null) {
            throw new IllegalArgumentException("detection config must be provided");
        }
        DetectionStrategy strategy = strategies.get(config.method());
        if (strategy == null) {
            throw new IllegalStateException("No detection strategy registered for " + config.method());
        }
        List<DataPoint> points = List.copyOf(series);
        DetectionOutcome outcome = strategy.detect(points, config);
        List<OutlierPoint> outliers = List.copyOf(outcome.outliers());

        int totalPoints = points.size();
        int outlierCount = outliers.size();
        double outlierPercentage = totalPoints == 0 ? 0d : outlierCount * 100.0 / totalPoints;
        DetectionResult.SeverityBreakdown breakdown = DetectionResult.SeverityBreakdown.of(outliers);
        DetectionResult.Statistics statistics = new DetectionResult.Statistics(totalPoints, outlierCount, outlierPercentage, breakdown);

        log.debug("Outlier detection: method={} sensitivity={} points={} outliers={}",
                config.method(), config.sensitivity(), totalPoints, outlierCount);

        return new DetectionResult(
                outliers,
                config.method(),
                outcome.threshold(),
                visualizationFor(points, outliers),
                statistics,
                summarize(statistics)
        );
    }

    private DetectionResult.Visualization visualizationFor(List<DataPoint> points, List<OutlierPoint> outliers) {
        // band is always the 1.5×IQR fence so charts look the same for every method
        double[] sorted = SeriesStatistics.sorted(SeriesStatistics.values(points));
        DetectionResult.Thresholds thresholds = SeriesStatistics.iqrBounds(sorted, SeriesStatistics.IQR_MULTIPLIER);
        List<Integer> outlierIndices = outliers.stream()
                .map(OutlierPoint::index)
                .toList();
        return new DetectionResult.Visualization(points, outlierIndices, thresholds, HIGHLIGHT_COLORS, NORMAL_COLOR);
    }

    static String summarize(DetectionResult.Statistics statistics) {
        int outlierCount = statistics.outlierCount();
        int totalPoints = statistics.totalPoints();
        if (outlierCount == 0) {
            return "No outliers detected in " + totalPoints + " data points. Data quality appears good.";
        }
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Detected %d outlier%s (%.1f%% of %d points)",
                outlierCount,
                outlierCount > 1 ? "s" : "",
                statistics.outlierPercentage(),
                totalPoints));

        List<String> severityParts = new ArrayList<>();
        for (Severity severity : List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW)) {
            int count = statistics.severityBreakdown().count(severity);
            if (count > 0) {
                severityParts.add(count + " " + severity.label());
            }
        }
        if (!severityParts.isEmpty()) {
            parts.add("Severity: " + String.join(", ", severityParts));
        }
        return String.join(". ", parts) + ".";
    }
}
