package com.capacitylens.quality.analytics;

import com.capacitylens.quality.model.Severity;

/**
 * Shared severity rule. Either the z-score or the normalized distance past the threshold
 * can escalate a point on its own.
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
    }

    public static Severity classify(double zScore, double distanceFromThreshold, double scale) {
        double absZScore = Math.abs(zScore);
        double normalizedDistance = normalize(distanceFromThreshold, scale);
        if (absZScore > 4 || normalizedDistance > 3) {
            return Severity.CRITICAL;
        }
        if (absZScore > 3 || normalizedDistance > 2) {
            return Severity.HIGH;
        }
        if (absZScore > 2 || normalizedDistance > 1) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // a zero scale (flat baseline) makes any positive distance unbounded
    private static double normalize(double distanceFromThreshold, double scale) {
        if (scale == 0) {
            return distanceFromThreshold > 0 ? Double.POSITIVE_INFINITY : 0d;
        }
        return distanceFromThreshold / scale;
    }

    public static String suggestedAction(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "Immediate investigation required. Consider removal or correction.";
            case HIGH -> "Review data point. May require correction or special handling.";
            case MEDIUM -> "Monitor this value. Consider transformation or capping.";
            case LOW -> "Minor outlier. May be acceptable depending on context.";
        };
    }
}
