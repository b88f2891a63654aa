package com.capacitylens.quality.config;

import com.capacitylens.quality.guidance.Aggressiveness;
import com.capacitylens.quality.guidance.GuidancePolicy;
import com.capacitylens.quality.guidance.ScoringPreset;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import com.capacitylens.quality.model.Sensitivity;
import com.capacitylens.quality.model.StrategyType;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "quality")
public record QualityProperties(
        Detection detection,
        Guidance guidance
) {

    @ConstructorBinding
    public QualityProperties {
        // both sections are optional; missing ones fall back to the built-in defaults
        if (detection == null) {
            detection = new Detection(null, null, null);
        }
        if (guidance == null) {
            guidance = new Guidance(null, null, null, null, null);
        }
    }

    public record Detection(DetectionMethod method, Sensitivity sensitivity, Double threshold) {
        public Detection {
            if (threshold != null && threshold < 0) {
                throw new IllegalArgumentException("threshold must not be negative");
            }
        }

        public DetectionConfig toConfig() {
            return new DetectionConfig(method, sensitivity, threshold);
        }
    }

    public record Guidance(
            Double maxOutlierPercentageForRemoval,
            Integer minDataPointsRequired,
            List<StrategyType> preferredMethods,
            Aggressiveness aggressiveness,
            ScoringPreset scoring
    ) {
        public Guidance {
            if (maxOutlierPercentageForRemoval != null
                    && (maxOutlierPercentageForRemoval < 0 || maxOutlierPercentageForRemoval > 100)) {
                throw new IllegalArgumentException("maxOutlierPercentageForRemoval must be within [0,100]");
            }
            if (minDataPointsRequired != null && minDataPointsRequired <= 0) {
                throw new IllegalArgumentException("minDataPointsRequired must be positive");
            }
        }

        public GuidancePolicy toPolicy() {
            GuidancePolicy defaults = GuidancePolicy.defaults();
            return new GuidancePolicy(
                    maxOutlierPercentageForRemoval != null ? maxOutlierPercentageForRemoval : defaults.maxOutlierPercentageForRemoval(),
                    minDataPointsRequired != null ? minDataPointsRequired : defaults.minDataPointsRequired(),
                    preferredMethods,
                    aggressiveness,
                    scoring
            );
        }
    }
}
