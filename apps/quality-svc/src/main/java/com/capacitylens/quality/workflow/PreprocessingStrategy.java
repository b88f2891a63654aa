package com.capacitylens.quality.workflow;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StepResult;
import com.capacitylens.quality.model.StrategyType;
import java.util.List;
import java.util.Map;

/**
 * Handler for one kind of preprocessing step. Registering a new bean is enough for the
 * workflow service to dispatch to it.
 */
public interface PreprocessingStrategy {

    StrategyType type();

    StepResult apply(List<DataPoint> series, Map<String, Object> parameters);
}
