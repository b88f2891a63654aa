package com.capacitylens.quality.model;

public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH
}
