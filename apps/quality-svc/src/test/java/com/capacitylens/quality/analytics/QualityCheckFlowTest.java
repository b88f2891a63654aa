package com.capacitylens.quality.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.capacitylens.quality.SeriesFixtures;
import com.capacitylens.quality.analytics.detection.IqrDetectionStrategy;
import com.capacitylens.quality.analytics.detection.IsolationHeuristicDetectionStrategy;
import com.capacitylens.quality.analytics.detection.ZScoreDetectionStrategy;
import com.capacitylens.quality.guidance.GuidancePolicy;
import com.capacitylens.quality.guidance.PreprocessingAdvisor;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import com.capacitylens.quality.model.PreprocessingSuggestion;
import com.capacitylens.quality.model.StepStatus;
import com.capacitylens.quality.model.StrategyType;
import com.capacitylens.quality.model.WorkflowStatus;
import com.capacitylens.quality.validation.PreprocessingValidator;
import com.capacitylens.quality.workflow.CappingStrategy;
import com.capacitylens.quality.workflow.ImputationStrategy;
import com.capacitylens.quality.workflow.PreprocessingWorkflowService;
import com.capacitylens.quality.workflow.RemovalStrategy;
import com.capacitylens.quality.workflow.StepParameters;
import com.capacitylens.quality.workflow.TransformationStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityCheckFlowTest {

    private final GuidancePolicy policy = GuidancePolicy.defaults();
    private final StepParameters stepParameters = new StepParameters(new ObjectMapper());
    private final QualityCheckService service = new QualityCheckService(
            new ActivationClassifier(),
            new OutlierDetectionService(List.of(new IqrDetectionStrategy(), new ZScoreDetectionStrategy(), new IsolationHeuristicDetectionStrategy())),
            new PreprocessingAdvisor(policy),
            new PreprocessingWorkflowService(List.of(
                    new RemovalStrategy(stepParameters),
                    new ImputationStrategy(stepParameters),
                    new CappingStrategy(stepParameters),
                    new TransformationStrategy(stepParameters))),
            new PreprocessingValidator(policy),
            DetectionConfig.of(DetectionMethod.IQR)
    );

    @Test
    void imputingTheSpikeCleansALongSeries() {
        List<DataPoint> series = longSeriesWithSpike();

        QualityCheckService.QualityCheck check = service.check("Run a quality check", series).orElseThrow();
        assertThat(check.detection().outliers()).hasSize(1);
        PreprocessingSuggestion imputation = check.suggestions().stream()
                .filter(suggestion -> suggestion.type() == StrategyType.IMPUTATION)
                .findFirst()
                .orElseThrow();

        QualityCheckService.PreparationOutcome outcome = service.prepare(series, check.detection(), List.of(imputation));

        assertThat(outcome.execution().completed()).isTrue();
        assertThat(outcome.execution().workflow().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(outcome.execution().workflow().getSteps()).allMatch(step -> step.getStatus() == StepStatus.COMPLETED);
        assertThat(outcome.execution().processedData()).hasSize(series.size());
        assertThat(outcome.execution().processedData().get(15).value()).isEqualTo(11.5);
        assertThat(outcome.validation().improvements().outlierReduction()).isPositive();
        assertThat(outcome.validation().statistics().processed().outlierCount()).isZero();
    }

    // 10,11,12 repeated with one spike at index 15
    private static List<DataPoint> longSeriesWithSpike() {
        double[] values = new double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10 + (i % 3);
        }
        values[15] = 100;
        return new ArrayList<>(SeriesFixtures.of(values));
    }
}
