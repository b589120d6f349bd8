package com.poolintelligence.scoring.service;

import com.poolintelligence.common.consensus.ConsensusResult;
import com.poolintelligence.common.enrich.EnrichedPool;
import com.poolintelligence.common.execution.ExecutionCostResult;
import com.poolintelligence.common.score.Score;
import com.poolintelligence.common.tracker.TvlDropResult;
import com.poolintelligence.common.yield.VolatilityEstimate;

/** Everything the scoring pipeline produced for one pool in one pass. */
public record PoolAssessment(
    String poolId,
    EnrichedPool pool,
    VolatilityEstimate measuredVolatility,
    ConsensusResult consensus,
    ExecutionCostResult executionCost,
    TvlDropResult tvlDrop,
    Score score
) {}
