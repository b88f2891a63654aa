package com.capacitylens.quality.model;

import java.time.Instant;

public record OutlierPoint(
        int index,
        double value,
        Instant timestamp,
        double zScore,
        Severity severity,
        String reason,
        String suggestedAction,
        double distanceFromThreshold
) {
}
