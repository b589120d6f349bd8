package com.poolintelligence.common.health;

import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.stats.StatMath;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Institutional health score: a weighted base of five signals, gated by multiplicative penalties.
 *
 * <h3>Components (each in [0,1])</h3>
 * <pre>
 *   tvlScore       = (log10(max(TVL,1)) − 4) / 4            $10K → $100M
 *   volScore       = (log10(max(vol1h,1) + 1) − 3) / 4      ~$1K/h → $10M/h
 *   feeYieldScore  = fees1h / TVL × 1000
 *   stabilityScore = 1 − vol / threshold                    0.35 STABLE, 1.20 otherwise
 *   freshnessScore = exp(−ageMinutes / 10)
 *   base = 0.35·tvl + 0.30·vol + 0.20·feeYield + 0.10·stability + 0.05·freshness
 * </pre>
 *
 * <h3>Gates</h3>
 * <pre>
 *   p1 = clamp(0.70·tvlScore + 0.30, 0.30, 1)
 *   p2 = clamp(0.70·volScore + 0.30, 0.30, 1)
 *   p3 = 0.35 on any severe warning, 0.60 on any moderate warning, else 1 (worst case wins)
 *   p4 = 0.55 when APR &gt; 300% and vol1h &lt; $50K, else 1
 *   penaltyTotal = clamp(p1·p2·p3·p4, 0.15, 1)
 *   score = round(100 · base · penaltyTotal)
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class HealthScorer {

    static final double W_TVL       = 0.35;
    static final double W_VOLUME    = 0.30;
    static final double W_FEE_YIELD = 0.20;
    static final double W_STABILITY = 0.10;
    static final double W_FRESHNESS = 0.05;

    static final double STABLE_VOL_THRESHOLD  = 0.35;
    static final double DEFAULT_VOL_THRESHOLD = 1.20;

    static final double SEVERE_FLAG_FACTOR   = 0.35;
    static final double MODERATE_FLAG_FACTOR = 0.60;

    static final double SPIKE_APR_THRESHOLD     = 300.0;
    static final double SPIKE_VOLUME_THRESHOLD  = 50_000.0;
    static final double SPIKE_FACTOR            = 0.55;

    static final double PENALTY_FLOOR = 0.15;

    static final List<String> SEVERE_KEYWORDS   = List.of("honeypot", "not verified", "rug");
    static final List<String> MODERATE_KEYWORDS = List.of("liquidity low", "unverified", "new pool", "suspect");

    private HealthScorer() {}

    public static HealthScoreResult calcHealthScore(HealthInput input) {
        double tvl = input.tvl();
        double vol1h = input.volume1h() != null ? input.volume1h() : 0.0;
        double fees1h = input.fees1h() != null ? input.fees1h() : 0.0;
        List<String> warnings = input.warnings() != null ? List.copyOf(input.warnings()) : List.of();

        double tvlScore = StatMath.clamp((Math.log10(Math.max(tvl, 1)) - 4) / (8 - 4), 0, 1);
        double volScore = StatMath.clamp((Math.log10(Math.max(vol1h, 1) + 1) - 3) / (7 - 3), 0, 1);
        double feeYieldScore = StatMath.clamp((fees1h / Math.max(tvl, 1)) * 1000, 0, 1);

        double threshold = input.poolType() == PoolType.STABLE ? STABLE_VOL_THRESHOLD : DEFAULT_VOL_THRESHOLD;
        double stabilityScore = StatMath.clamp(1 - (input.volatilityAnn() / threshold), 0, 1);

        double ageMinutes = input.age() != null ? input.age().toMillis() / 60_000.0 : 0.0;
        double freshnessScore = StatMath.clamp(Math.exp(-ageMinutes / 10), 0, 1);

        double p1 = StatMath.clamp(tvlScore * 0.70 + 0.30, 0.30, 1.00);
        double p2 = StatMath.clamp(volScore * 0.70 + 0.30, 0.30, 1.00);
        double p3 = riskFlagFactor(warnings);
        double p4 = (input.aprTotal() != null && input.aprTotal() > SPIKE_APR_THRESHOLD
                     && vol1h < SPIKE_VOLUME_THRESHOLD) ? SPIKE_FACTOR : 1.0;

        double penaltyTotal = StatMath.clamp(p1 * p2 * p3 * p4, PENALTY_FLOOR, 1.00);

        double base = W_TVL * tvlScore
            + W_VOLUME * volScore
            + W_FEE_YIELD * feeYieldScore
            + W_STABILITY * stabilityScore
            + W_FRESHNESS * freshnessScore;

        int score = (int) StatMath.clamp(Math.round(100 * base * penaltyTotal), 0, 100);

        HealthBreakdown breakdown = new HealthBreakdown(
            tvlScore, volScore, feeYieldScore, stabilityScore, freshnessScore,
            p1, p2, p3, p4, base);
        return new HealthScoreResult(score, penaltyTotal, breakdown, warnings);
    }

    /**
     * Worst-case factor across all warnings; matching is case-insensitive substring search.
     * A warning that matches a severe keyword is not re-checked against the moderate set.
     */
    static double riskFlagFactor(List<String> warnings) {
        double factor = 1.0;
        for (String w : warnings) {
            if (w == null) continue;
            String lower = w.toLowerCase(Locale.ROOT);
            if (containsAny(lower, SEVERE_KEYWORDS)) {
                factor = Math.min(factor, SEVERE_FLAG_FACTOR);
            } else if (containsAny(lower, MODERATE_KEYWORDS)) {
                factor = Math.min(factor, MODERATE_FLAG_FACTOR);
            }
        }
        return factor;
    }

    /** Convenience for callers that only hold the last-updated instant. */
    public static Duration ageOf(Instant updatedAt, Instant now) {
        if (updatedAt == null || now == null) return Duration.ZERO;
        return Duration.between(updatedAt, now);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }
}
