package com.capacitylens.quality.model;

public enum DetectionMethod {
    IQR,
    Z_SCORE,
    /** Nearest-neighbour distance score; an approximation, not an isolation forest. */
    ISOLATION_HEURISTIC
}
