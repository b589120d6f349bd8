package com.poolintelligence.common.health;

/**
 * Every intermediate figure behind a health score: the five [0,1] component scores, the four
 * multiplicative gates and the weighted base before gating.
 */
public record HealthBreakdown(
    double tvlScore,
    double volScore,
    double feeYieldScore,
    double stabilityScore,
    double freshnessScore,
    double p1Liquidity,
    double p2Activity,
    double p3RiskFlags,
    double p4SpikeTrap,
    double base
) {}
