package com.capacitylens.quality.model;

import java.util.Optional;

public record DetectionConfig(
        DetectionMethod method,
        Sensitivity sensitivity,
        Double threshold
) {
    public DetectionConfig {
        if (method == null) {
            method = DetectionMethod.IQR;
        }
        if (sensitivity == null) {
            sensitivity = Sensitivity.MEDIUM;
        }
    }

    public static DetectionConfig of(DetectionMethod method) {
        return new DetectionConfig(method, Sensitivity.MEDIUM, null);
    }

    public static DetectionConfig of(DetectionMethod method, Sensitivity sensitivity) {
        return new DetectionConfig(method, sensitivity, null);
    }

    /**
     * Explicit threshold, when one was given. Zero or negative values count as unset.
     */
    public Optional<Double> thresholdOverride() {
        return threshold != null && threshold > 0 ? Optional.of(threshold) : Optional.empty();
    }
}
