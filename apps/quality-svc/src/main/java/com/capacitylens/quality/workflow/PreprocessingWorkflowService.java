package com.capacitylens.quality.workflow;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionResult;
import com.capacitylens.quality.model.PreprocessingSuggestion;
import com.capacitylens.quality.model.StepResult;
import com.capacitylens.quality.model.StepStatus;
import com.capacitylens.quality.model.StrategyType;
import com.capacitylens.quality.model.Workflow;
import com.capacitylens.quality.model.WorkflowStatus;
import com.capacitylens.quality.model.WorkflowStep;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PreprocessingWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingWorkflowService.class);

    private static final double QUALITY_POINTS_PER_APPLICABILITY = 20d;
    // share of the data quality gain expected to show up as forecast accuracy
    private static final double FORECAST_GAIN_RATIO = 0.3;

    private final Map<StrategyType, PreprocessingStrategy> strategies = new EnumMap<>(StrategyType.class);

    public PreprocessingWorkflowService(List<PreprocessingStrategy> strategies) {
        for (PreprocessingStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
    }

    public Workflow createWorkflow(List<PreprocessingSuggestion> suggestions, List<DataPoint> series, DetectionResult detectionResult) {
        if (suggestions == null || series == null || detectionResult == null) {
            throw new IllegalArgumentException("suggestions, series and detection result must be provided");
        }
        List<WorkflowStep> steps = new ArrayList<>(suggestions.size());
        for (int i = 0; i < suggestions.size(); i++) {
            PreprocessingSuggestion suggestion = suggestions.get(i);
            steps.add(new WorkflowStep(
                    "step-" + (i + 1),
                    suggestion.id(),
                    suggestion.type(),
                    i + 1,
                    suggestion.implementation().parameters(),
                    suggestion.title()));
        }
        return new Workflow(UUID.randomUUID(), steps, estimateImpact(suggestions, series, detectionResult), Instant.now());
    }

    /**
     * Runs one step against {@code series}. Failures never escape: they come back as an
     * unsuccessful result carrying the unmodified series, and the step is marked failed.
     */
    public StepResult executeStep(WorkflowStep step, List<DataPoint> series) {
        if (step == null || series == null) {
            throw new IllegalArgumentException("step and series must be provided");
        }
        step.setStatus(StepStatus.IN_PROGRESS);
        String label = step.getType() == null ? "unknown" : step.getType().label();
        try {
            PreprocessingStrategy strategy = step.getType() == null ? null : strategies.get(step.getType());
            if (strategy == null) {
                throw new IllegalStateException("Unknown preprocessing type: " + label);
            }
            StepResult result = strategy.apply(series, step.getParameters());
            step.setStatus(StepStatus.COMPLETED);
            step.setResult(result);
            log.debug("Step {} ({}) completed: affected={} improvement={}",
                    step.getId(), label, result.recordsAffected(), result.qualityImprovement());
            return result;
        } catch (RuntimeException ex) {
            log.warn("Step {} ({}) failed: {}", step.getId(), label, ex.getMessage());
            StepResult failure = StepResult.failure(
                    series,
                    "Failed to execute " + label + " step",
                    List.of(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
            step.setStatus(StepStatus.FAILED);
            step.setResult(failure);
            return failure;
        }
    }

    /**
     * Runs every step that has not completed yet, in order, each on the previous output.
     * Stops at the first failure and leaves the workflow FAILED; running it again resumes
     * from the failed step. {@code series} is the original input: completed steps are not
     * re-run, their stored output feeds the next step.
     */
    public WorkflowExecution runWorkflow(Workflow workflow, List<DataPoint> series) {
        if (workflow == null || series == null) {
            throw new IllegalArgumentException("workflow and series must be provided");
        }
        workflow.setStatus(WorkflowStatus.IN_PROGRESS);
        List<DataPoint> current = List.copyOf(series);
        List<StepResult> results = new ArrayList<>();
        for (WorkflowStep step : workflow.getSteps()) {
            if (step.getStatus() == StepStatus.COMPLETED) {
                current = step.getResult().map(StepResult::processedData).orElse(current);
                continue;
            }
            StepResult result = executeStep(step, current);
            results.add(result);
            if (!result.success()) {
                workflow.setStatus(WorkflowStatus.FAILED);
                log.warn("Workflow {} halted at {} after {} step(s)", workflow.getId(), step.getId(), results.size());
                return new WorkflowExecution(workflow, current, results);
            }
            current = result.processedData();
        }
        workflow.setStatus(WorkflowStatus.COMPLETED);
        workflow.setCompletedAt(Instant.now());
        log.info("Workflow {} completed: steps={} points {} -> {}",
                workflow.getId(), workflow.getSteps().size(), series.size(), current.size());
        return new WorkflowExecution(workflow, current, results);
    }

    private Workflow.WorkflowImpact estimateImpact(List<PreprocessingSuggestion> suggestions, List<DataPoint> series, DetectionResult detectionResult) {
        double dataQualityImprovement = suggestions.stream()
                .mapToDouble(suggestion -> suggestion.applicability() * QUALITY_POINTS_PER_APPLICABILITY)
                .sum();
        dataQualityImprovement = Math.min(100d, dataQualityImprovement);
        long recordsAffected = (long) suggestions.size() * detectionResult.statistics().outlierCount();
        return new Workflow.WorkflowImpact(
                dataQualityImprovement,
                (int) Math.min(recordsAffected, series.size()),
                dataQualityImprovement * FORECAST_GAIN_RATIO);
    }
}
