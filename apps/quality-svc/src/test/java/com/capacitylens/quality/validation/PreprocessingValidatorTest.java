package com.capacitylens.quality.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.capacitylens.quality.SeriesFixtures;
import com.capacitylens.quality.guidance.GuidancePolicy;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.ValidationReport;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PreprocessingValidatorTest {

    private final PreprocessingValidator validator = new PreprocessingValidator(GuidancePolicy.defaults());

    @Test
    void unchangedCleanSeriesIsReadyForForecasting() {
        List<DataPoint> series = SeriesFixtures.steady(30);

        ValidationReport report = validator.validateResults(series, series);

        assertThat(report.valid()).isTrue();
        assertThat(report.concerns()).isEmpty();
        assertThat(report.improvements().outlierReduction()).isZero();
        assertThat(report.improvements().varianceReduction()).isZero();
        assertThat(report.improvements().normalityImprovement()).isZero();
        assertThat(report.improvements().dataQualityScore()).isCloseTo(87.48, within(0.01));
        assertThat(report.recommendations()).containsExactly("Data is now ready for forecasting. Proceed with model training.");
        assertThat(report.statistics().original()).isEqualTo(report.statistics().processed());
    }

    @Test
    void flagsOverSmoothingAndSmallResult() {
        List<DataPoint> original = SeriesFixtures.of(10, 12, 11, 13, 12, 100, 11, 10, 12, 11);
        List<DataPoint> processed = new ArrayList<>(original);
        processed.remove(5);

        ValidationReport report = validator.validateResults(original, processed);

        assertThat(report.valid()).isFalse();
        assertThat(report.improvements().outlierReduction()).isCloseTo(10.0, within(1e-9));
        assertThat(report.improvements().varianceReduction()).isGreaterThan(90);
        assertThat(report.concerns()).containsExactly(
                "Variance reduced by more than 50%. Data may be over-smoothed.",
                "Dataset now has fewer than 30 points. May not be sufficient for reliable forecasting.");
        assertThat(report.statistics().processed().count()).isEqualTo(9);
    }

    @Test
    void flagsHeavyRemoval() {
        List<DataPoint> original = SeriesFixtures.steady(40);
        List<DataPoint> processed = original.subList(0, 25);

        ValidationReport report = validator.validateResults(original, processed);

        assertThat(report.concerns()).contains("More than 30% of data was removed. Consider using less aggressive preprocessing.");
        assertThat(report.valid()).isFalse();
    }

    @Test
    void measuresOutlierReductionInPercentagePoints() {
        List<DataPoint> original = SeriesFixtures.of(10, 11, 12, 10, 11, 12, 10, 500);
        List<DataPoint> capped = SeriesFixtures.of(10, 11, 12, 10, 11, 12, 10, 12);

        ValidationReport report = validator.validateResults(original, capped);

        assertThat(report.statistics().original().outlierPercentage()).isCloseTo(12.5, within(1e-9));
        assertThat(report.improvements().outlierReduction()).isCloseTo(12.5, within(1e-9));
        assertThat(report.improvements().normalityImprovement()).isPositive();
        assertThat(report.improvements().dataQualityScore()).isBetween(0.0, 100.0);
    }

    @Test
    void emptySeriesDoNotBreakScoring() {
        ValidationReport report = validator.validateResults(List.of(), List.of());

        assertThat(report.valid()).isFalse();
        assertThat(report.improvements().varianceReduction()).isZero();
        assertThat(report.improvements().dataQualityScore()).isBetween(0.0, 100.0);
    }

    @Test
    void rejectsMissingSeries() {
        assertThatThrownBy(() -> validator.validateResults(null, List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
