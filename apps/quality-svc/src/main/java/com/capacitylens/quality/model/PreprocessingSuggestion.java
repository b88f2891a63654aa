package com.capacitylens.quality.model;

import java.util.List;
import java.util.Map;

public record PreprocessingSuggestion(
        String id,
        StrategyType type,
        String title,
        String description,
        List<String> pros,
        List<String> cons,
        double applicability,
        Implementation implementation
) {
    public PreprocessingSuggestion {
        if (applicability < 0.0 || applicability > 1.0) {
            throw new IllegalArgumentException("applicability must be within [0,1]: " + applicability);
        }
    }

    public record Implementation(String method, Map<String, Object> parameters, String expectedOutcome) {
    }
}
