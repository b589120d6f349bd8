package com.poolintelligence.scoring.service;

import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.range.FeeEstimate;
import com.poolintelligence.common.range.IlRiskResult;
import com.poolintelligence.common.range.RangeResult;

/**
 * Suggested liquidity position for one (pool, mode, horizon, capital) combination.
 *
 * @param recommendedMode the score's own mode, for comparison when {@code mode} was chosen by the caller
 */
public record PositionPlan(
    String poolId,
    RiskMode mode,
    RiskMode recommendedMode,
    double price,
    double volatilityAnn,
    double horizonDays,
    double capitalUsd,
    RangeResult range,
    FeeEstimate fees,
    IlRiskResult ilRisk
) {}
