package com.capacitylens.quality.analytics;

import com.capacitylens.quality.guidance.PreprocessingAdvisor;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.PreprocessingSuggestion;
import com.capacitylens.quality.model.ValidationReport;
import com.capacitylens.quality.model.Workflow;
import com.capacitylens.quality.validation.PreprocessingValidator;
import com.capacitylens.quality.workflow.PreprocessingWorkflowService;
import com.capacitylens.quality.workflow.WorkflowExecution;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the dashboard: decides whether a request is a quality check, runs
 * detection and guidance, and later applies the suggestions the user picked.
 */
@Service
public class QualityCheckService {

    private static final Logger log = LoggerFactory.getLogger(QualityCheckService.class);

    private final ActivationClassifier activationClassifier;
    private final OutlierDetectionService outlierDetectionService;
    private final PreprocessingAdvisor preprocessingAdvisor;
    private final PreprocessingWorkflowService workflowService;
    private final PreprocessingValidator validator;
    private final DetectionConfig defaultDetectionConfig;

    public QualityCheckService(
            ActivationClassifier activationClassifier,
            OutlierDetectionService outlierDetectionService,
            PreprocessingAdvisor preprocessingAdvisor,
            PreprocessingWorkflowService workflowService,
            PreprocessingValidator validator,
            DetectionConfig defaultDetectionConfig
    ) {
        this.activationClassifier = activationClassifier;
        this.outlierDetectionService = outlierDetectionService;
        this.preprocessingAdvisor = preprocessingAdvisor;
        this.workflowService = workflowService;
        this.validator = validator;
        this.defaultDetectionConfig = defaultDetectionConfig;
    }

    public Optional<QualityCheck> check(String utterance, List<DataPoint> series) {
        return check(utterance, series, defaultDetectionConfig);
    }

    public Optional<QualityCheck> check(String utterance, List<DataPoint> series, DetectionConfig config) {
        if (!activationClassifier.shouldActivate(utterance)) {
            log.debug("Quality check not requested");
            return Optional.empty();
        }
        DetectionResult detection = outlierDetectionService.detect(series, config);
        List<PreprocessingSuggestion> suggestions = preprocessingAdvisor.generateSuggestions(detection, series);
        return Optional.of(new QualityCheck(detection, suggestions));
    }

    public PreparationOutcome prepare(List<DataPoint> series, DetectionResult detection, List<PreprocessingSuggestion> selected) {
        Workflow workflow = workflowService.createWorkflow(selected, series, detection);
        WorkflowExecution execution = workflowService.runWorkflow(workflow, series);
        ValidationReport validation = validator.validateResults(series, execution.processedData());
        return new PreparationOutcome(execution, validation);
    }

    public record QualityCheck(DetectionResult detection, List<PreprocessingSuggestion> suggestions) {
    }

    public record PreparationOutcome(WorkflowExecution execution, ValidationReport validation) {
    }
}
