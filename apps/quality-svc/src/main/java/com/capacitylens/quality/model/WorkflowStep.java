package com.capacitylens.quality.model;

import java.util.Map;
import java.util.Optional;

/**
 * One step of a preprocessing workflow. Status and result change in place while the
 * workflow runs, so callers can inspect partial progress.
 */
public class WorkflowStep {

    private final String id;
    private final String suggestionId;
    private final StrategyType type;
    private final int order;
    private final Map<String, Object> parameters;
    private final String description;
    private StepStatus status;
    private StepResult result;

    public WorkflowStep(String id, String suggestionId, StrategyType type, int order, Map<String, Object> parameters, String description) {
        if (order < 1) {
            throw new IllegalArgumentException("order must be 1 or greater");
        }
        this.id = id;
        this.suggestionId = suggestionId;
        this.type = type;
        this.order = order;
        this.parameters = parameters == null ? Map.of() : parameters;
        this.description = description;
        this.status = StepStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public String getSuggestionId() {
        return suggestionId;
    }

    public StrategyType getType() {
        return type;
    }

    public int getOrder() {
        return order;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getDescription() {
        return description;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = status;
    }

    public Optional<StepResult> getResult() {
        return Optional.ofNullable(result);
    }

    public void setResult(StepResult result) {
        this.result = result;
    }
}
