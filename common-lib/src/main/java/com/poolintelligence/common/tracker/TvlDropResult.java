package com.poolintelligence.common.tracker;

/**
 * Drop of the current TVL from its trailing 24h peak.
 *
 * @param tvlPeak24h           rounded to whole dollars
 * @param dropPercent          0–100, one decimal
 * @param dataPoints           snapshots inside the 24h window
 * @param liquidityDropPenalty additive risk points, 0–20
 */
public record TvlDropResult(
    double tvlNow,
    double tvlPeak24h,
    double dropPercent,
    int dataPoints,
    int liquidityDropPenalty
) {
    static TvlDropResult noHistory(double tvl) {
        return new TvlDropResult(tvl, tvl, 0.0, 0, 0);
    }
}
