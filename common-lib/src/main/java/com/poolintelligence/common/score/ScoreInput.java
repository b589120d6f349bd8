package com.poolintelligence.common.score;

import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;

/**
 * Everything the composer needs for one pool, already collected by the caller.
 *
 * @param volatilityAnn measured annualized volatility as a fraction; {@code null} when not measured
 * @param aprTotal      best available APR in percent (fee APR, else provider APR); may be {@code null}
 */
public record ScoreInput(
    PoolSnapshot pool,
    PoolType poolType,
    boolean bluechip,
    Double volatilityAnn,
    Double aprTotal,
    int liquidityDropPenalty,
    int inconsistencyPenalty,
    int executionCostPenalty
) {
    /** Input with no external penalties, for callers that only have the snapshot. */
    public static ScoreInput of(PoolSnapshot pool, PoolType poolType, boolean bluechip,
                                Double volatilityAnn, Double aprTotal) {
        return new ScoreInput(pool, poolType, bluechip, volatilityAnn, aprTotal, 0, 0, 0);
    }
}
