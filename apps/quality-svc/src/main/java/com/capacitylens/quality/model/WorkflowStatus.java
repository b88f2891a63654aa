package com.capacitylens.quality.model;

public enum WorkflowStatus {
    DRAFT,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
