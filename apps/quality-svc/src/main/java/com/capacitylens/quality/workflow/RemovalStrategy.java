package com.capacitylens.quality.workflow;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StrategyType;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

@Component
public class RemovalStrategy extends AbstractPreprocessingStrategy {

    public RemovalStrategy(StepParameters stepParameters) {
        super(stepParameters);
    }

    @Override
    public StrategyType type() {
        return StrategyType.REMOVAL;
    }

    @Override
    protected Transformed transform(List<DataPoint> series, Map<String, Object> parameters) {
        Set<Integer> removeIndices = new HashSet<>(stepParameters.indices(parameters, "removeIndices"));
        List<DataPoint> kept = IntStream.range(0, series.size())
                .filter(index -> !removeIndices.contains(index))
                .mapToObj(series::get)
                .toList();
        return new Transformed(kept, series.size() - kept.size(), 0);
    }
}
