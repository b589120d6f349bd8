package com.poolintelligence.common.execution;

import com.poolintelligence.common.model.PoolType;

/**
 * @param impact100            estimated price impact of a $100 trade, percent
 * @param impact1000           estimated price impact of a $1000 trade, percent
 * @param executionCostPenalty additive risk points, 0–10
 */
public record ExecutionCostResult(
    double impact100,
    double impact1000,
    int executionCostPenalty,
    PoolType poolType,
    String reason
) {}
