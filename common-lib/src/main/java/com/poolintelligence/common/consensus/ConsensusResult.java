package com.poolintelligence.common.consensus;

import java.util.List;
import java.util.Map;

/**
 * Cross-provider agreement for one pool.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code tvlBySource} / {@code volumeBySource}: metric values keyed by provider name</li>
 *   <li>{@code maxDivergence}:        worst of the TVL and volume divergences, in percent</li>
 *   <li>{@code inconsistencyPenalty}: additive risk points, 0–15</li>
 *   <li>{@code reason}:               human-readable explanation</li>
 * </ul>
 */
public record ConsensusResult(
    String poolAddress,
    String chain,
    Map<String, Double> tvlBySource,
    Map<String, Double> volumeBySource,
    double maxDivergence,
    double tvlDivergence,
    double volumeDivergence,
    List<String> sources,
    int inconsistencyPenalty,
    String reason
) {
    public static final String SINGLE_SOURCE_REASON = "single source — no comparison possible";

    /** Zero-penalty result carrying only whatever sources were available. */
    public static ConsensusResult withoutComparison(String poolAddress, String chain,
                                                    Map<String, Double> tvlBySource,
                                                    Map<String, Double> volumeBySource,
                                                    String reason) {
        return new ConsensusResult(poolAddress, chain, Map.copyOf(tvlBySource), Map.copyOf(volumeBySource),
            0.0, 0.0, 0.0, List.copyOf(tvlBySource.keySet()), 0, reason);
    }
}
