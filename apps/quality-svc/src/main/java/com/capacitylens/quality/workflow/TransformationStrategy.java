package com.capacitylens.quality.workflow;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StrategyType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import org.springframework.stereotype.Component;

@Component
public class TransformationStrategy extends AbstractPreprocessingStrategy {

    public TransformationStrategy(StepParameters stepParameters) {
        super(stepParameters);
    }

    @Override
    public StrategyType type() {
        return StrategyType.TRANSFORMATION;
    }

    @Override
    protected Transformed transform(List<DataPoint> series, Map<String, Object> parameters) {
        String name = stepParameters.text(parameters, "transformation", "log1p");
        DoubleUnaryOperator function = functionFor(name);
        List<DataPoint> processed = series.stream()
                .map(point -> point.withValue(function.applyAsDouble(point.value())))
                .toList();
        return new Transformed(processed, 0, series.size());
    }

    static DoubleUnaryOperator functionFor(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "log1p" -> value -> Math.log1p(Math.max(0, value));
            case "sqrt" -> value -> Math.sqrt(Math.max(0, value));
            case "square" -> value -> value * value;
            // square root stands in for Box-Cox at lambda 0.5
            case "boxcox" -> value -> value > 0 ? Math.sqrt(value) : 0;
            default -> throw new IllegalArgumentException("Unsupported transformation: " + name);
        };
    }
}
