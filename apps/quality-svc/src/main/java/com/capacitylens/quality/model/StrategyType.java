package com.capacitylens.quality.model;

import java.util.Locale;

public enum StrategyType {
    REMOVAL,
    IMPUTATION,
    CAPPING,
    TRANSFORMATION;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
