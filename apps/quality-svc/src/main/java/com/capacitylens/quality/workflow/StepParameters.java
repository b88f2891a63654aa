package com.capacitylens.quality.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Typed reads over the untyped parameter maps carried by workflow steps. Values that cannot
 * be converted raise {@link IllegalArgumentException}.
 */
@Component
public class StepParameters {

    private static final TypeReference<List<Integer>> INDEX_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public StepParameters(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Integer> indices(Map<String, Object> parameters, String key) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return List.of();
        }
        return objectMapper.convertValue(raw, INDEX_LIST);
    }

    public double number(Map<String, Object> parameters, String key, double defaultValue) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return defaultValue;
        }
        Double value = objectMapper.convertValue(raw, Double.class);
        if (value == null || value.isNaN()) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be numeric");
        }
        return value;
    }

    public String text(Map<String, Object> parameters, String key, String defaultValue) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return defaultValue;
        }
        return objectMapper.convertValue(raw, String.class);
    }
}
