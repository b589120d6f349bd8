package com.poolintelligence.common.yield;

/** Spacing of a price series, used to annualize per-period volatility. */
public enum SamplingInterval {
    HOURLY(24 * 365),
    FIVE_MINUTE(12 * 24 * 365);

    private final int periodsPerYear;

    SamplingInterval(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }
}
