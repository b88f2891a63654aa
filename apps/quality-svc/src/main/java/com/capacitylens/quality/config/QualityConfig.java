package com.capacitylens.quality.config;

import com.capacitylens.quality.guidance.GuidancePolicy;
import com.capacitylens.quality.model.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QualityConfig {
    private static final Logger log = LoggerFactory.getLogger(QualityConfig.class);

    @Bean
    DetectionConfig defaultDetectionConfig(QualityProperties properties) {
        DetectionConfig config = properties.detection().toConfig();
        log.info("Quality: default detection method={} sensitivity={}", config.method(), config.sensitivity());
        return config;
    }

    @Bean
    GuidancePolicy guidancePolicy(QualityProperties properties) {
        GuidancePolicy policy = properties.guidance().toPolicy();
        log.info("Quality: guidance scoring={} aggressiveness={} maxRemovalPercentage={} minPoints={}",
                policy.scoring(), policy.aggressiveness(), policy.maxOutlierPercentageForRemoval(), policy.minDataPointsRequired());
        return policy;
    }
}
