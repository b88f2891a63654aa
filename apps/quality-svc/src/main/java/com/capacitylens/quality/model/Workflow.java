package com.capacitylens.quality.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class Workflow {

    private final UUID id;
    private final List<WorkflowStep> steps;
    private final WorkflowImpact estimatedImpact;
    private final Instant createdAt;
    private WorkflowStatus status;
    private Instant completedAt;

    public Workflow(UUID id, List<WorkflowStep> steps, WorkflowImpact estimatedImpact, Instant createdAt) {
        this.id = id;
        this.steps = steps.stream()
                .sorted(Comparator.comparingInt(WorkflowStep::getOrder))
                .toList();
        this.estimatedImpact = estimatedImpact;
        this.createdAt = createdAt;
        this.status = WorkflowStatus.DRAFT;
    }

    public UUID getId() {
        return id;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public WorkflowImpact getEstimatedImpact() {
        return estimatedImpact;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public void setStatus(WorkflowStatus status) {
        this.status = status;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public record WorkflowImpact(double dataQualityImprovement, int recordsAffected, double forecastAccuracyGain) {
    }
}
