package com.capacitylens.quality.validation;

import com.capacitylens.quality.analytics.SeriesStatistics;
import com.capacitylens.quality.guidance.GuidancePolicy;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DataStatistics;
import com.capacitylens.quality.model.ValidationReport;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PreprocessingValidator {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingValidator.class);

    private static final double MIN_RETAINED_FRACTION = 0.7;
    private static final double MIN_RETAINED_SPREAD = 0.5;

    private final int minDataPointsRequired;

    public PreprocessingValidator(GuidancePolicy policy) {
        this.minDataPointsRequired = policy.minDataPointsRequired();
    }

    public ValidationReport validateResults(List<DataPoint> original, List<DataPoint> processed) {
        if (original == null || processed == null) {
            throw new IllegalArgumentException("original and processed series must be provided");
        }
        DataStatistics originalStats = SeriesStatistics.describe(original);
        DataStatistics processedStats = SeriesStatistics.describe(processed);

        double outlierReduction = QualityScoring.outlierReduction(originalStats, processedStats);
        double varianceReduction = QualityScoring.varianceReduction(originalStats, processedStats);
        double normalityImprovement = QualityScoring.normalityImprovement(originalStats, processedStats);
        double dataQualityScore = QualityScoring.dataQualityScore(processedStats);

        List<String> concerns = new ArrayList<>();
        if (processed.size() < original.size() * MIN_RETAINED_FRACTION) {
            concerns.add("More than 30% of data was removed. Consider using less aggressive preprocessing.");
        }
        if (processedStats.stdDev() < originalStats.stdDev() * MIN_RETAINED_SPREAD) {
            concerns.add("Variance reduced by more than 50%. Data may be over-smoothed.");
        }
        if (processed.size() < minDataPointsRequired) {
            concerns.add("Dataset now has fewer than " + minDataPointsRequired
                    + " points. May not be sufficient for reliable forecasting.");
        }

        List<String> recommendations = new ArrayList<>();
        if (outlierReduction > 50) {
            recommendations.add("Excellent outlier reduction. Data quality significantly improved.");
        }
        if (dataQualityScore > 80) {
            recommendations.add("Data is now ready for forecasting. Proceed with model training.");
        } else if (dataQualityScore > 60) {
            recommendations.add("Data quality is acceptable. Consider additional preprocessing if needed.");
        } else {
            recommendations.add("Data quality could be improved further. Consider additional preprocessing steps.");
        }

        boolean valid = concerns.isEmpty() && dataQualityScore > 50;
        log.debug("Validation: original={} processed={} score={} concerns={}",
                original.size(), processed.size(), dataQualityScore, concerns.size());
        return new ValidationReport(
                valid,
                new ValidationReport.Improvements(outlierReduction, varianceReduction, normalityImprovement, dataQualityScore),
                List.copyOf(concerns),
                List.copyOf(recommendations),
                new ValidationReport.Snapshot(originalStats, processedStats)
        );
    }
}
