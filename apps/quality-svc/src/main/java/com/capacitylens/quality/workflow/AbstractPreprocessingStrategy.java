package com.capacitylens.quality.workflow;

import com.capacitylens.quality.analytics.SeriesStatistics;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StepResult;
import com.capacitylens.quality.validation.QualityScoring;
import java.util.List;
import java.util.Map;

abstract class AbstractPreprocessingStrategy implements PreprocessingStrategy {

    protected final StepParameters stepParameters;

    protected AbstractPreprocessingStrategy(StepParameters stepParameters) {
        this.stepParameters = stepParameters;
    }

    @Override
    public final StepResult apply(List<DataPoint> series, Map<String, Object> parameters) {
        Transformed transformed = transform(series, parameters);
        double qualityImprovement = QualityScoring.stepImprovement(
                SeriesStatistics.describe(series),
                SeriesStatistics.describe(transformed.processed()));
        return new StepResult(
                true,
                transformed.processed(),
                transformed.recordsRemoved() + transformed.recordsModified(),
                transformed.recordsRemoved(),
                transformed.recordsModified(),
                qualityImprovement,
                "Successfully executed " + type().label() + " preprocessing step",
                List.of()
        );
    }

    protected abstract Transformed transform(List<DataPoint> series, Map<String, Object> parameters);

    protected record Transformed(List<DataPoint> processed, int recordsRemoved, int recordsModified) {
    }
}
