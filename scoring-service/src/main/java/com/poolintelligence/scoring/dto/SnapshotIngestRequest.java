package com.poolintelligence.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PricePoint;
import com.poolintelligence.common.yield.SamplingInterval;

import java.util.List;

/**
 * One collector push for one pool.
 *
 * @param priceHistory optional series for measured volatility
 * @param interval     sampling interval of {@code priceHistory}; HOURLY when absent
 * @param warnings     free-text risk warnings found by other checks
 * @param source       provider that produced the snapshot; the configured primary when absent
 */
public record SnapshotIngestRequest(
    @JsonProperty("snapshot") PoolSnapshot snapshot,
    @JsonProperty("priceHistory") List<PricePoint> priceHistory,
    @JsonProperty("interval") SamplingInterval interval,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("source") String source
) {
    public static SnapshotIngestRequest of(PoolSnapshot snapshot) {
        return new SnapshotIngestRequest(snapshot, List.of(), SamplingInterval.HOURLY, List.of(), null);
    }
}
