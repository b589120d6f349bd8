package com.poolintelligence.common.score;

/**
 * Tunable limits of the score composer.
 *
 * @param minLiquidity              TVL below this flags the pool as suspect
 * @param minVolume24h              24h volume below this flags the pool as suspect
 * @param aggressiveVolatilityMax   annualized volatility in percent allowed for AGGRESSIVE
 * @param normalVolatilityMax       annualized volatility in percent allowed for NORMAL
 * @param unknownVolatilityScoreGate total needed for NORMAL when volatility was not measured
 */
public record ScoringThresholds(
    double minLiquidity,
    double minVolume24h,
    double aggressiveVolatilityMax,
    double normalVolatilityMax,
    double unknownVolatilityScoreGate
) {
    public static ScoringThresholds defaults() {
        return new ScoringThresholds(100_000, 10_000, 30, 15, 75);
    }
}
