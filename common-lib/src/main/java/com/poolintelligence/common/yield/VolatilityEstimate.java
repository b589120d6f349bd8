package com.poolintelligence.common.yield;

/**
 * Annualized volatility estimate.
 *
 * @param volAnn     annualized volatility as a fraction; {@code 0} means "not measured"
 * @param method     how it was obtained
 * @param dataPoints price samples that went in
 */
public record VolatilityEstimate(
    double volAnn,
    VolatilityMethod method,
    int dataPoints
) {
    static VolatilityEstimate notMeasured(int dataPoints) {
        return new VolatilityEstimate(0.0, VolatilityMethod.PROXY, dataPoints);
    }

    /** {@code false} for the "not measured" sentinel, which callers must not read as zero risk. */
    public boolean isMeasured() {
        return volAnn > 0;
    }
}
