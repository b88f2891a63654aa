package com.capacitylens.quality.guidance;

public enum Aggressiveness {
    CONSERVATIVE(1, 99),
    MODERATE(5, 95),
    AGGRESSIVE(10, 90);

    private final int lowerPercentile;
    private final int upperPercentile;

    Aggressiveness(int lowerPercentile, int upperPercentile) {
        this.lowerPercentile = lowerPercentile;
        this.upperPercentile = upperPercentile;
    }

    public int lowerPercentile() {
        return lowerPercentile;
    }

    public int upperPercentile() {
        return upperPercentile;
    }
}
