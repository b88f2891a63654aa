package com.capacitylens.quality.guidance;

/**
 * How applicability scores are derived.
 */
public enum ScoringPreset {
    /** Fixed score per strategy. */
    SIMPLE,
    /** Scores that step down as the outlier share grows. */
    POLICY_DRIVEN
}
