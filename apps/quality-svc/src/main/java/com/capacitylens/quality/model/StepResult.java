package com.capacitylens.quality.model;

import java.util.List;

public record StepResult(
        boolean success,
        List<DataPoint> processedData,
        int recordsAffected,
        int recordsRemoved,
        int recordsModified,
        double qualityImprovement,
        String message,
        List<String> errors
) {
    public StepResult {
        processedData = List.copyOf(processedData);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static StepResult failure(List<DataPoint> unchanged, String message, List<String> errors) {
        return new StepResult(false, unchanged, 0, 0, 0, 0.0, message, errors);
    }
}
