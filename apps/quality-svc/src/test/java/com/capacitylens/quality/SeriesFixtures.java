package com.capacitylens.quality;

import com.capacitylens.quality.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SeriesFixtures {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private SeriesFixtures() {
    }

    public static List<DataPoint> of(double... values) {
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(START.plus(Duration.ofDays(i)), values[i], Optional.of(100L)));
        }
        return points;
    }

    /** 10,11,12,13,14 repeated; no IQR outliers. */
    public static List<DataPoint> steady(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 10 + (i % 5);
        }
        return of(values);
    }
}
