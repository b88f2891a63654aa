package com.capacitylens.quality.workflow;

import com.capacitylens.quality.analytics.SeriesStatistics;
import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StrategyType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Winsorization: clamps values to percentile bounds of the input series.
 */
@Component
public class CappingStrategy extends AbstractPreprocessingStrategy {

    public CappingStrategy(StepParameters stepParameters) {
        super(stepParameters);
    }

    @Override
    public StrategyType type() {
        return StrategyType.CAPPING;
    }

    @Override
    protected Transformed transform(List<DataPoint> series, Map<String, Object> parameters) {
        double lowerPercentile = stepParameters.number(parameters, "lowerPercentile", 5);
        double upperPercentile = stepParameters.number(parameters, "upperPercentile", 95);
        if (lowerPercentile < 0 || upperPercentile > 100 || lowerPercentile > upperPercentile) {
            throw new IllegalArgumentException("Capping percentiles must satisfy 0 <= lower <= upper <= 100, got "
                    + lowerPercentile + "/" + upperPercentile);
        }
        double[] sorted = SeriesStatistics.sorted(SeriesStatistics.values(series));
        double lowerBound = SeriesStatistics.percentile(sorted, lowerPercentile);
        double upperBound = SeriesStatistics.percentile(sorted, upperPercentile);

        List<DataPoint> processed = new ArrayList<>(series.size());
        int recordsModified = 0;
        for (DataPoint point : series) {
            if (point.value() < lowerBound) {
                processed.add(point.withValue(lowerBound));
                recordsModified++;
            } else if (point.value() > upperBound) {
                processed.add(point.withValue(upperBound));
                recordsModified++;
            } else {
                processed.add(point);
            }
        }
        return new Transformed(List.copyOf(processed), 0, recordsModified);
    }
}
