package com.poolintelligence.common.health;

import com.poolintelligence.common.model.PoolType;

import java.time.Duration;
import java.util.List;

/**
 * Input projection for {@link HealthScorer}.
 *
 * @param tvl           pool TVL in USD
 * @param volume1h      1h volume in USD, {@code null} read as 0
 * @param fees1h        1h fees in USD, {@code null} read as 0
 * @param volatilityAnn annualized volatility (fraction)
 * @param poolType      selects the stability threshold
 * @param age           time since the snapshot was last updated
 * @param aprTotal      headline APR in percent, may be {@code null}
 * @param warnings      free-text risk warnings, may be {@code null}
 */
public record HealthInput(
    double tvl,
    Double volume1h,
    Double fees1h,
    double volatilityAnn,
    PoolType poolType,
    Duration age,
    Double aprTotal,
    List<String> warnings
) {}
