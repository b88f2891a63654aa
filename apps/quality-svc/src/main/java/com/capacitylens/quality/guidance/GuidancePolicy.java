package com.capacitylens.quality.guidance;

import com.capacitylens.quality.model.StrategyType;
import java.util.List;

public record GuidancePolicy(
        double maxOutlierPercentageForRemoval,
        int minDataPointsRequired,
        List<StrategyType> preferredMethods,
        Aggressiveness aggressiveness,
        ScoringPreset scoring
) {
    public static final List<StrategyType> DEFAULT_PREFERENCE = List.of(
            StrategyType.CAPPING,
            StrategyType.IMPUTATION,
            StrategyType.REMOVAL,
            StrategyType.TRANSFORMATION
    );

    public GuidancePolicy {
        if (maxOutlierPercentageForRemoval < 0 || maxOutlierPercentageForRemoval > 100) {
            throw new IllegalArgumentException("maxOutlierPercentageForRemoval must be within [0,100]");
        }
        if (minDataPointsRequired <= 0) {
            throw new IllegalArgumentException("minDataPointsRequired must be positive");
        }
        preferredMethods = preferredMethods == null || preferredMethods.isEmpty()
                ? DEFAULT_PREFERENCE
                : List.copyOf(preferredMethods);
        if (aggressiveness == null) {
            aggressiveness = Aggressiveness.MODERATE;
        }
        if (scoring == null) {
            scoring = ScoringPreset.POLICY_DRIVEN;
        }
    }

    public static GuidancePolicy defaults() {
        return new GuidancePolicy(5, 30, DEFAULT_PREFERENCE, Aggressiveness.MODERATE, ScoringPreset.POLICY_DRIVEN);
    }

    /**
     * Fixed-score preset: removal below 5% outliers, standard 5/95 capping.
     */
    public static GuidancePolicy simple() {
        return new GuidancePolicy(5, 30, DEFAULT_PREFERENCE, Aggressiveness.MODERATE, ScoringPreset.SIMPLE);
    }

    public GuidancePolicy withMaxOutlierPercentageForRemoval(double percentage) {
        return new GuidancePolicy(percentage, minDataPointsRequired, preferredMethods, aggressiveness, scoring);
    }

    public boolean allowsRemoval(double outlierPercentage) {
        return scoring == ScoringPreset.SIMPLE
                ? outlierPercentage < maxOutlierPercentageForRemoval
                : outlierPercentage <= maxOutlierPercentageForRemoval;
    }

    public int preferenceRank(StrategyType type) {
        int rank = preferredMethods.indexOf(type);
        return rank < 0 ? preferredMethods.size() : rank;
    }
}
