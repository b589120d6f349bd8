package com.poolintelligence.common.range;

/**
 * Expected fee income for a position. 7d and 30d are linear multiples of 24h.
 *
 * @param userLiquidityShare capital / TVL
 * @param activeFraction     assumed in-range share of time for the chosen mode
 */
public record FeeEstimate(
    double expectedFees24h,
    double expectedFees7d,
    double expectedFees30d,
    double userLiquidityShare,
    double activeFraction
) {}
