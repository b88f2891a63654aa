package com.capacitylens.quality.analytics.detection;

import com.capacitylens.quality.model.OutlierPoint;
import java.util.List;

public record DetectionOutcome(List<OutlierPoint> outliers, double threshold) {
}
