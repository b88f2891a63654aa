package com.capacitylens.quality.analytics;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Decides whether a free-text request asks for an anomaly or data quality check.
 */
@Component
public class ActivationClassifier {

    private static final List<String> ACTIVATION_PHRASES = List.of(
            "quality check",
            "anomalies",
            "anomaly",
            "outliers",
            "outlier",
            "unusual values",
            "unusual value",
            "data issues",
            "data issue",
            "data quality",
            "bad data",
            "incorrect data",
            "suspicious values",
            "suspicious value",
            "extreme values",
            "extreme value"
    );

    public boolean shouldActivate(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return false;
        }
        String normalized = utterance.toLowerCase(Locale.ROOT);
        return ACTIVATION_PHRASES.stream().anyMatch(normalized::contains);
    }
}
