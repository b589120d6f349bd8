package com.poolintelligence.common.consensus;

import com.poolintelligence.common.model.PoolSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Detects disagreement between data providers on TVL and 24h volume.
 *
 * <h3>Batch mode</h3>
 * Primary-source pools are compared with one secondary source. A pool's penalty is the
 * maximum of its TVL and volume penalties, never their sum.
 *
 * <h3>Single-pool mode</h3>
 * Up to {@value #MAX_SOURCES} sources; the maximum pairwise divergence across all pairs of
 * positive readings is used, not only pairs involving the primary.
 *
 * <p>Fewer than two sources never produce a penalty. Only on-chain {@code 0x} addresses are compared.
 *
 * <p>Stateless and thread-safe. Works on data already collected in memory; no I/O.
 */
public final class ConsensusDetector {

    public static final int MAX_SOURCES = 3;

    static final String NOT_APPLICABLE_REASON = "non-0x address — consensus not applicable";

    private ConsensusDetector() {}

    /**
     * @param secondaryByAddress secondary readings keyed by lower-case pool address
     * @return results keyed by lower-case pool address, in input order
     */
    public static Map<String, ConsensusResult> compareBatch(String chain,
                                                            String primarySource,
                                                            List<PoolSnapshot> pools,
                                                            String secondarySource,
                                                            Map<String, SourceMetrics> secondaryByAddress) {
        Objects.requireNonNull(primarySource, "primarySource");
        Map<String, ConsensusResult> results = new LinkedHashMap<>();
        if (pools == null) return results;
        Map<String, SourceMetrics> secondary = secondaryByAddress != null ? secondaryByAddress : Map.of();

        for (PoolSnapshot pool : pools) {
            if (!isComparable(pool)) continue;
            String address = pool.poolAddress().toLowerCase(Locale.ROOT);

            Map<String, Double> tvlBySource = new LinkedHashMap<>();
            Map<String, Double> volumeBySource = new LinkedHashMap<>();
            tvlBySource.put(primarySource, pool.tvl());
            volumeBySource.put(primarySource, pool.volume24hOrZero());

            SourceMetrics other = secondary.get(address);
            if (other == null || secondarySource == null || secondarySource.equals(primarySource)) {
                results.put(address, ConsensusResult.withoutComparison(pool.poolAddress(), chain,
                    tvlBySource, volumeBySource, ConsensusResult.SINGLE_SOURCE_REASON));
                continue;
            }
            tvlBySource.put(secondarySource, other.tvl());
            volumeBySource.put(secondarySource, other.volume24h());

            double tvlDivergence = DivergenceCalculator.calcDivergence(pool.tvl(), other.tvl());
            double volumeDivergence = DivergenceCalculator.calcDivergence(pool.volume24hOrZero(), other.volume24h());
            double maxDivergence = Math.max(tvlDivergence, volumeDivergence);
            int penalty = Math.max(
                DivergenceCalculator.divergenceToPenalty(tvlDivergence),
                DivergenceCalculator.divergenceToPenalty(volumeDivergence));

            String reason = batchReason(maxDivergence, tvlDivergence, volumeDivergence,
                pool.tvl(), other.tvl(), pool.volume24hOrZero(), other.volume24h());

            results.put(address, new ConsensusResult(pool.poolAddress(), chain,
                Map.copyOf(tvlBySource), Map.copyOf(volumeBySource),
                maxDivergence, tvlDivergence, volumeDivergence,
                List.copyOf(tvlBySource.keySet()), penalty, reason));
        }
        return results;
    }

    /**
     * @param otherSources readings from other providers; only the first {@code MAX_SOURCES − 1}
     *                     distinct sources are used
     */
    public static ConsensusResult compareSingle(String chain,
                                                String primarySource,
                                                PoolSnapshot pool,
                                                List<SourceMetrics> otherSources) {
        Objects.requireNonNull(primarySource, "primarySource");
        Objects.requireNonNull(pool, "pool");
        Map<String, Double> tvlBySource = new LinkedHashMap<>();
        Map<String, Double> volumeBySource = new LinkedHashMap<>();
        tvlBySource.put(primarySource, pool.tvl());
        volumeBySource.put(primarySource, pool.volume24hOrZero());

        if (!isComparable(pool)) {
            return ConsensusResult.withoutComparison(pool.poolAddress(), chain,
                tvlBySource, volumeBySource, NOT_APPLICABLE_REASON);
        }

        if (otherSources != null) {
            for (SourceMetrics m : otherSources) {
                if (tvlBySource.size() >= MAX_SOURCES) break;
                if (m == null || m.source() == null || tvlBySource.containsKey(m.source())) continue;
                tvlBySource.put(m.source(), m.tvl());
                volumeBySource.put(m.source(), m.volume24h());
            }
        }

        if (tvlBySource.size() < 2) {
            return ConsensusResult.withoutComparison(pool.poolAddress(), chain,
                tvlBySource, volumeBySource, ConsensusResult.SINGLE_SOURCE_REASON);
        }

        double maxTvlDivergence = maxPairwiseDivergence(tvlBySource.values());
        double maxVolumeDivergence = maxPairwiseDivergence(volumeBySource.values());
        double maxDivergence = Math.max(maxTvlDivergence, maxVolumeDivergence);
        int penalty = DivergenceCalculator.divergenceToPenalty(maxDivergence);

        List<String> sources = List.copyOf(tvlBySource.keySet());
        String reason = maxDivergence <= DivergenceCalculator.AGREEMENT_THRESHOLD
            ? String.format(Locale.ROOT, "%d sources agree (%.1f%% max divergence)", sources.size(), maxDivergence)
            : String.format(Locale.ROOT, "divergence %.1f%% across %s", maxDivergence, String.join(", ", sources));

        return new ConsensusResult(pool.poolAddress(), chain,
            Map.copyOf(tvlBySource), Map.copyOf(volumeBySource),
            maxDivergence, maxTvlDivergence, maxVolumeDivergence, sources, penalty, reason);
    }

    static boolean isComparable(PoolSnapshot pool) {
        return pool != null && pool.poolAddress() != null
            && pool.poolAddress().toLowerCase(Locale.ROOT).startsWith("0x");
    }

    /** Pairwise maximum over positive readings only; a missing reading does not count as disagreement here. */
    private static double maxPairwiseDivergence(Iterable<Double> readings) {
        List<Double> positive = new ArrayList<>();
        for (Double v : readings) {
            if (v != null && v > 0) positive.add(v);
        }
        double max = 0.0;
        for (int i = 0; i < positive.size(); i++) {
            for (int j = i + 1; j < positive.size(); j++) {
                max = Math.max(max, DivergenceCalculator.calcDivergence(positive.get(i), positive.get(j)));
            }
        }
        return max;
    }

    private static String batchReason(double maxDivergence, double tvlDivergence, double volumeDivergence,
                                      double primaryTvl, double secondaryTvl,
                                      double primaryVolume, double secondaryVolume) {
        if (maxDivergence <= DivergenceCalculator.AGREEMENT_THRESHOLD) {
            return String.format(Locale.ROOT, "sources agree (%.1f%% divergence)", maxDivergence);
        }
        List<String> parts = new ArrayList<>();
        if (tvlDivergence > DivergenceCalculator.AGREEMENT_THRESHOLD) {
            parts.add(String.format(Locale.ROOT, "TVL diverges %.1f%% ($%.0fK vs $%.0fK)",
                tvlDivergence, primaryTvl / 1e3, secondaryTvl / 1e3));
        }
        if (volumeDivergence > DivergenceCalculator.AGREEMENT_THRESHOLD) {
            parts.add(String.format(Locale.ROOT, "Vol diverges %.1f%% ($%.0fK vs $%.0fK)",
                volumeDivergence, primaryVolume / 1e3, secondaryVolume / 1e3));
        }
        return String.join("; ", parts);
    }
}
