package com.capacitylens.quality.model;

public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
