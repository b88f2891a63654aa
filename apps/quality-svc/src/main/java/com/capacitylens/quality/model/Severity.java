package com.capacitylens.quality.model;

import java.util.Locale;

/**
 * Ordinal strength of an anomaly, weakest first.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
