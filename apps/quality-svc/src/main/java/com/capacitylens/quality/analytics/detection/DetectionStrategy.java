package com.capacitylens.quality.analytics.detection;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.DetectionConfig;
import com.capacitylens.quality.model.DetectionMethod;
import java.util.List;

/**
 * One outlier detection algorithm. Implementations are stateless and must tolerate empty
 * and zero-variance series.
 */
public interface DetectionStrategy {

    DetectionMethod method();

    DetectionOutcome detect(List<DataPoint> series, DetectionConfig config);
}
