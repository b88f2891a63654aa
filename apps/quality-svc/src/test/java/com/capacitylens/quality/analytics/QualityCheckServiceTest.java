package com.capacitylens.quality.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.capacitylens.quality.SeriesFixtures;
import com.capacitylens.quality.guidance.PreprocessingAdvisor;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.PreprocessingSuggestion;
import com.capacitylens.quality.model.Sensitivity;
import com.capacitylens.quality.model.StrategyType;
import com.capacitylens.quality.validation.PreprocessingValidator;
import com.capacitylens.quality.workflow.PreprocessingWorkflowService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class QualityCheckServiceTest {

    @Mock
    private ActivationClassifier activationClassifier;

    @Mock
    private OutlierDetectionService outlierDetectionService;

    @Mock
    private PreprocessingAdvisor preprocessingAdvisor;

    @Mock
    private PreprocessingWorkflowService workflowService;

    @Mock
    private PreprocessingValidator validator;

    private final DetectionConfig defaultConfig = DetectionConfig.of(DetectionMethod.IQR);

    private QualityCheckService qualityCheckService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        qualityCheckService = new QualityCheckService(activationClassifier, outlierDetectionService, preprocessingAdvisor,
                workflowService, validator, defaultConfig);
    }

    @Test
    void skipsDetectionWhenNotRequested() {
        List<DataPoint> series = SeriesFixtures.of(1, 2, 3);
        when(activationClassifier.shouldActivate("Forecast next month")).thenReturn(false);

        Optional<QualityCheckService.QualityCheck> check = qualityCheckService.check("Forecast next month", series);

        assertThat(check).isEmpty();
        verify(outlierDetectionService, never()).detect(any(), any());
        verifyNoInteractions(preprocessingAdvisor);
    }

    @Test
    void detectsAndSuggestsWithDefaultConfig() {
        List<DataPoint> series = SeriesFixtures.of(10, 12, 11, 13, 12, 100, 11, 10, 12, 11);
        DetectionResult detection = emptyDetection(series.size());
        List<PreprocessingSuggestion> suggestions = List.of(suggestion());
        when(activationClassifier.shouldActivate("check for outliers")).thenReturn(true);
        when(outlierDetectionService.detect(series, defaultConfig)).thenReturn(detection);
        when(preprocessingAdvisor.generateSuggestions(detection, series)).thenReturn(suggestions);

        Optional<QualityCheckService.QualityCheck> check = qualityCheckService.check("check for outliers", series);

        assertThat(check).isPresent();
        assertThat(check.get().detection()).isSameAs(detection);
        assertThat(check.get().suggestions()).isEqualTo(suggestions);
    }

    @Test
    void honoursExplicitConfig() {
        List<DataPoint> series = SeriesFixtures.of(1, 2, 3);
        DetectionConfig config = DetectionConfig.of(DetectionMethod.Z_SCORE, Sensitivity.HIGH);
        DetectionResult detection = emptyDetection(series.size());
        when(activationClassifier.shouldActivate("anomaly")).thenReturn(true);
        when(outlierDetectionService.detect(series, config)).thenReturn(detection);
        when(preprocessingAdvisor.generateSuggestions(detection, series)).thenReturn(List.of());

        assertThat(qualityCheckService.check("anomaly", series, config)).isPresent();
        verify(outlierDetectionService).detect(series, config);
    }

    private static DetectionResult emptyDetection(int totalPoints) {
        DetectionResult.Statistics statistics = new DetectionResult.Statistics(totalPoints, 0, 0,
                new DetectionResult.SeverityBreakdown(0, 0, 0, 0));
        return new DetectionResult(List.of(), DetectionMethod.IQR, 0, null, statistics, OutlierDetectionService.summarize(statistics));
    }

    private static PreprocessingSuggestion suggestion() {
        return new PreprocessingSuggestion("imputation", StrategyType.IMPUTATION, "Impute", "Impute outliers",
                List.of(), List.of(), 0.7,
                new PreprocessingSuggestion.Implementation("interpolation", Map.of("method", "linear"), "Values replaced"));
    }
}
