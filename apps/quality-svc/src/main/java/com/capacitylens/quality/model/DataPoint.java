package com.capacitylens.quality.model;

import java.time.Instant;
import java.util.Optional;

public record DataPoint(
        Instant timestamp,
        double value,
        Optional<Long> volume
) {
    public DataPoint {
        if (volume == null) {
            volume = Optional.empty();
        }
    }

    public DataPoint withValue(double newValue) {
        return new DataPoint(timestamp, newValue, volume);
    }
}
