package com.poolintelligence.common.score;

import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.stats.StatMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines health, return and risk into the final 0–100 pool score.
 *
 * <h3>Formula</h3>
 * <pre>
 *   health = W_health · (0.4·liquidityStability + 0.2·ageScore + 0.4·volumeConsistency) / 100
 *   return = W_return · (0.3·volumeTvlRatio + 0.3·feeEfficiency + 0.4·min(aprEstimate, 100)) / 100
 *   risk   = min(volatility + liquidityDrop + inconsistency + executionCost, W_risk)
 *   total  = clamp(health + return − risk, 0, 100)
 * </pre>
 *
 * <h3>Recommended mode</h3>
 * <pre>
 *   volatility unknown          → NORMAL if total ≥ 75, else DEFENSIVE
 *   total ≥ 70 and vol% ≤ 30    → AGGRESSIVE   (NORMAL for STABLE pools)
 *   total ≥ 50 and vol% ≤ 15    → NORMAL
 *   otherwise                   → DEFENSIVE
 * </pre>
 *
 * <p>Fails closed: an unexpected exception yields total 0, DEFENSIVE, suspect.
 * Stateless and thread-safe.
 */
public class ScoreComposer {

    private static final Logger log = LoggerFactory.getLogger(ScoreComposer.class);

    static final double HEALTH_LIQUIDITY_WEIGHT   = 0.4;
    static final double HEALTH_AGE_WEIGHT         = 0.2;
    static final double HEALTH_CONSISTENCY_WEIGHT = 0.4;

    static final double RETURN_VOLUME_WEIGHT = 0.3;
    static final double RETURN_FEE_WEIGHT    = 0.3;
    static final double RETURN_APR_WEIGHT    = 0.4;

    static final double AGGRESSIVE_MIN_TOTAL = 70;
    static final double NORMAL_MIN_TOTAL     = 50;

    static final double SUSPECT_APR            = 500;
    static final double SUSPECT_VOLUME_TO_TVL  = 10;
    static final int    SUSPECT_INCONSISTENCY  = 15;

    static final int UNKNOWN_VOLATILITY_PENALTY = 10;

    private final ScoreWeights weights;
    private final ScoringThresholds thresholds;

    public ScoreComposer(ScoreWeights weights, ScoringThresholds thresholds) {
        this.weights = weights;
        this.thresholds = thresholds;
    }

    public static ScoreComposer withDefaults() {
        return new ScoreComposer(ScoreWeights.defaults(), ScoringThresholds.defaults());
    }

    public ScoringThresholds thresholds() {
        return thresholds;
    }

    public Score compose(ScoreInput input) {
        try {
            ScoreBreakdown breakdown = breakdown(input);

            double health = healthScore(breakdown.health());
            double ret = returnScore(breakdown.ret());
            double risk = Math.min(breakdown.risk().sum(), weights.risk());
            double total = StatMath.clamp(health + ret - risk, 0, 100);

            RiskMode mode = recommendMode(input.poolType(), volatilityPercent(input.volatilityAnn()), total);
            List<String> reasons = suspectReasons(input, breakdown);

            return new Score(
                StatMath.round(total, 1),
                StatMath.round(health, 1),
                StatMath.round(ret, 1),
                StatMath.round(risk, 1),
                breakdown,
                mode,
                !reasons.isEmpty(),
                List.copyOf(reasons));
        } catch (RuntimeException e) {
            String poolId = input != null && input.pool() != null ? input.pool().poolId() : "unknown";
            log.error("SCORE_FAILED pool={} error={}", poolId, e.getMessage(), e);
            return new Score(0, 0, 0, 0, ScoreBreakdown.empty(), RiskMode.DEFENSIVE, true,
                List.of("Calculation error: " + e.getMessage()));
        }
    }

    ScoreBreakdown breakdown(ScoreInput input) {
        PoolSnapshot pool = input.pool();
        double tvl = pool.tvl();
        double volume24h = pool.volume24hOrZero();

        ScoreBreakdown.Health health = new ScoreBreakdown.Health(
            liquidityStability(tvl),
            ageScore(tvl, volume24h, input.bluechip()),
            volumeConsistency(tvl, volume24h));

        ScoreBreakdown.Return ret = new ScoreBreakdown.Return(
            volumeTvlRatio(tvl, volume24h),
            StatMath.round(feeEfficiency(pool, input.aprTotal()), 1),
            aprEstimate(pool, input.aprTotal()));

        ScoreBreakdown.Risk risk = new ScoreBreakdown.Risk(
            volatilityPenalty(volatilityPercent(input.volatilityAnn())),
            input.liquidityDropPenalty(),
            input.inconsistencyPenalty(),
            input.executionCostPenalty());

        return new ScoreBreakdown(health, ret, risk);
    }

    private double healthScore(ScoreBreakdown.Health h) {
        return weights.health() * (
            (h.liquidityStability() / 100) * HEALTH_LIQUIDITY_WEIGHT
                + (h.ageScore() / 100) * HEALTH_AGE_WEIGHT
                + (h.volumeConsistency() / 100) * HEALTH_CONSISTENCY_WEIGHT);
    }

    private double returnScore(ScoreBreakdown.Return r) {
        double normalizedApr = Math.min(r.aprEstimate(), 100);
        return weights.ret() * (
            (r.volumeTvlRatio() / 100) * RETURN_VOLUME_WEIGHT
                + (r.feeEfficiency() / 100) * RETURN_FEE_WEIGHT
                + (normalizedApr / 100) * RETURN_APR_WEIGHT);
    }

    // ── Sub-scores ──────────────────────────────────────────────────────────────

    static double liquidityStability(double tvl) {
        if (tvl >= 10_000_000) return 100;
        if (tvl >= 5_000_000) return 90;
        if (tvl >= 1_000_000) return 75;
        if (tvl >= 500_000) return 60;
        if (tvl >= 100_000) return 40;
        return 20;
    }

    /** Maturity estimated from TVL, turnover and token quality; no on-chain age is available. */
    static double ageScore(double tvl, double volume24h, boolean bluechip) {
        double score = 30;

        if (tvl >= 10_000_000) score += 30;
        else if (tvl >= 1_000_000) score += 20;
        else if (tvl >= 100_000) score += 10;

        if (tvl > 0 && volume24h > 0) {
            double ratio = volume24h / tvl;
            if (ratio >= 0.01) score += 20;
            else if (ratio >= 0.005) score += 10;
        }

        if (bluechip) score += 20;
        return Math.min(100, score);
    }

    static double volumeConsistency(double tvl, double volume24h) {
        if (tvl <= 0) return 0;
        double ratio = volume24h / tvl;
        if (ratio >= 0.1) return 100;
        if (ratio >= 0.05) return 80;
        if (ratio >= 0.01) return 60;
        if (ratio >= 0.005) return 40;
        return 20;
    }

    static double volumeTvlRatio(double tvl, double volume24h) {
        if (tvl <= 0) return 0;
        double ratio = volume24h / tvl * 100;
        if (ratio >= 20) return 100;
        if (ratio >= 10) return 80;
        if (ratio >= 5) return 60;
        if (ratio >= 1) return 40;
        return 20;
    }

    static double feeEfficiency(PoolSnapshot pool, Double aprTotal) {
        double tvl = pool.tvl();
        if (StatMath.isPositive(pool.fees24h()) && tvl > 0) {
            double annualized = pool.fees24h() / tvl * 365 * 100;
            if (annualized >= 50) return 100;
            if (annualized >= 30) return 80;
            if (annualized >= 15) return 60;
            if (annualized >= 5) return 40;
            return 20;
        }
        double feeTierApr = feeTierApr(pool);
        if (feeTierApr > 0) {
            return Math.min(100, feeTierApr);
        }
        if (StatMath.isPositive(aprTotal)) {
            return Math.min(100, aprTotal);
        }
        return 20;
    }

    static double aprEstimate(PoolSnapshot pool, Double aprTotal) {
        if (StatMath.isPositive(aprTotal)) return aprTotal;
        return StatMath.round(feeTierApr(pool), 1);
    }

    /** APR implied by volume and fee tier; 0 when either is unknown. */
    public static double feeTierApr(PoolSnapshot pool) {
        double tvl = pool.tvl();
        double volume24h = pool.volume24hOrZero();
        if (tvl <= 0 || !StatMath.isPositive(pool.feeTier()) || volume24h <= 0) return 0;
        return (volume24h * pool.feeTier() * 365) / tvl * 100;
    }

    /** @return volatility in percent, or {@code null} when not measured */
    static Double volatilityPercent(Double volatilityAnn) {
        if (volatilityAnn == null || !(volatilityAnn > 0)) return null;
        return volatilityAnn * 100;
    }

    static int volatilityPenalty(Double volatilityPercent) {
        if (volatilityPercent == null) return UNKNOWN_VOLATILITY_PENALTY;
        if (volatilityPercent >= 30) return 25;
        if (volatilityPercent >= 20) return 20;
        if (volatilityPercent >= 10) return 12;
        if (volatilityPercent >= 5) return 5;
        return 0;
    }

    RiskMode recommendMode(PoolType poolType, Double volatilityPercent, double total) {
        if (volatilityPercent == null) {
            return total >= thresholds.unknownVolatilityScoreGate() ? RiskMode.NORMAL : RiskMode.DEFENSIVE;
        }
        if (total >= AGGRESSIVE_MIN_TOTAL && volatilityPercent <= thresholds.aggressiveVolatilityMax()) {
            // the stable width cap leaves no room for a wider aggressive band
            return poolType == PoolType.STABLE ? RiskMode.NORMAL : RiskMode.AGGRESSIVE;
        }
        if (total >= NORMAL_MIN_TOTAL && volatilityPercent <= thresholds.normalVolatilityMax()) {
            return RiskMode.NORMAL;
        }
        return RiskMode.DEFENSIVE;
    }

    List<String> suspectReasons(ScoreInput input, ScoreBreakdown breakdown) {
        PoolSnapshot pool = input.pool();
        double tvl = pool.tvl();
        double volume24h = pool.volume24hOrZero();
        List<String> reasons = new ArrayList<>();

        if (tvl < thresholds.minLiquidity()) reasons.add("TVL below minimum threshold");
        if (volume24h < thresholds.minVolume24h()) reasons.add("Volume below minimum threshold");
        if (StatMath.isPositive(input.aprTotal()) && input.aprTotal() > SUSPECT_APR) reasons.add("Unusually high APR");
        if (volume24h > tvl * SUSPECT_VOLUME_TO_TVL) reasons.add("Volume/TVL ratio too high");
        if (breakdown.risk().inconsistencyPenalty() > SUSPECT_INCONSISTENCY) {
            reasons.add("High data inconsistency between sources");
        }
        return reasons;
    }
}
