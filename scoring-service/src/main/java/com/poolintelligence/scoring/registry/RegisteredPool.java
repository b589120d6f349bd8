package com.poolintelligence.scoring.registry;

import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PricePoint;
import com.poolintelligence.common.yield.SamplingInterval;

import java.time.Instant;
import java.util.List;

/**
 * Latest collector output for one pool.
 *
 * @param source provider the snapshot came from; the primary source for consensus
 */
public record RegisteredPool(
    PoolSnapshot snapshot,
    List<PricePoint> priceHistory,
    SamplingInterval interval,
    List<String> warnings,
    String source,
    Instant receivedAt
) {
    public String poolId() {
        return snapshot.poolId();
    }
}
