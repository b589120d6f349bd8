package com.poolintelligence.common.recommend;

import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.score.Score;
import com.poolintelligence.common.score.ScoreComposer;
import com.poolintelligence.common.stats.StatMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a composed {@link Score} into the figures and checklists attached to a recommendation.
 *
 * <pre>
 *   probability = min(85, round(total × 0.7 × modeFactor))     DEFENSIVE 1.2 · NORMAL 1.0 · AGGRESSIVE 0.8
 *   gain%       = apr / 52 × modeFactor × total / 100          DEFENSIVE 0.7 · NORMAL 1.0 · AGGRESSIVE 1.3
 * </pre>
 *
 * The APR is the score's return estimate, falling back to the provider APR and then to the
 * fee-tier estimate when the score carries none.
 */
public final class RecommendationRules {

    public static final int MAX_PROBABILITY = 85;
    public static final int REASSESS_AFTER_DAYS = 7;
    public static final double EXIT_TVL_DROP_PERCENT = 30;

    private static final double THIN_LIQUIDITY_TVL = 500_000;
    private static final double LOW_TURNOVER = 0.01;
    private static final double YOUNG_POOL_AGE_SCORE = 30;
    private static final int HIGH_VOLATILITY_PENALTY = 10;

    private RecommendationRules() {}

    public static int probability(Score score, RiskMode mode) {
        double factor = switch (Objects.requireNonNull(mode, "mode")) {
            case DEFENSIVE -> 1.2;
            case NORMAL -> 1.0;
            case AGGRESSIVE -> 0.8;
        };
        return (int) Math.min(MAX_PROBABILITY, Math.round(score.total() * 0.7 * factor));
    }

    public static GainEstimate estimateGains(PoolSnapshot pool, Score score, double capitalUsd, RiskMode mode) {
        double factor = switch (Objects.requireNonNull(mode, "mode")) {
            case DEFENSIVE -> 0.7;
            case NORMAL -> 1.0;
            case AGGRESSIVE -> 1.3;
        };
        double weeklyPercent = baseApr(pool, score) / 52 * factor * (score.total() / 100);
        return new GainEstimate(
            StatMath.round(weeklyPercent, 2),
            StatMath.round(capitalUsd * weeklyPercent / 100, 2));
    }

    static double baseApr(PoolSnapshot pool, Score score) {
        double fromScore = score.breakdown() != null ? score.breakdown().ret().aprEstimate() : 0;
        if (fromScore > 0) return fromScore;
        if (StatMath.isPositive(pool.apr())) return pool.apr();
        return ScoreComposer.feeTierApr(pool);
    }

    public static List<String> entryConditions(PoolSnapshot pool, RiskMode mode) {
        List<String> conditions = new ArrayList<>();
        conditions.add("Current price close to its 24h average");
        double volumeFloor = pool.volume24hOrZero() * (mode == RiskMode.DEFENSIVE ? 0.8 : 0.5);
        conditions.add("24h volume above $" + formatUsd(volumeFloor));
        conditions.add("TVL holding above $" + formatUsd(pool.tvl() * 0.9));
        if (mode == RiskMode.AGGRESSIVE) {
            conditions.add("Positive momentum confirmed (price rising)");
        } else if (mode == RiskMode.DEFENSIVE) {
            conditions.add("Low volatility over the last 24h");
        }
        return conditions;
    }

    /**
     * @param minVolume24h daily volume below which the pool is considered dead
     */
    public static List<String> exitConditions(RiskMode mode, double minVolume24h) {
        int stopLoss = switch (Objects.requireNonNull(mode, "mode")) {
            case AGGRESSIVE -> 15;
            case NORMAL -> 10;
            case DEFENSIVE -> 5;
        };
        List<String> conditions = new ArrayList<>();
        conditions.add("Position value down " + stopLoss + "%");
        conditions.add(String.format(Locale.ROOT, "Pool TVL down %.0f%% or more", EXIT_TVL_DROP_PERCENT));
        conditions.add("Daily volume below $" + formatUsd(minVolume24h));
        if (mode == RiskMode.AGGRESSIVE) {
            conditions.add("Gain of 20%+ reached (take partial profit)");
        }
        conditions.add("Reassess the position after " + REASSESS_AFTER_DAYS + " days");
        return conditions;
    }

    /** Every matching rule contributes; a generic market risk is reported when none match. */
    public static List<String> mainRisks(PoolSnapshot pool, Score score) {
        List<String> risks = new ArrayList<>();
        if (score.breakdown().risk().volatilityPenalty() > HIGH_VOLATILITY_PENALTY) {
            risks.add("High volatility: elevated impermanent loss risk");
        }
        if (pool.tvl() < THIN_LIQUIDITY_TVL) {
            risks.add("Moderate liquidity: slippage may be significant");
        }
        if (pool.volume24hOrZero() < pool.tvl() * LOW_TURNOVER) {
            risks.add("Low relative volume: may signal fading interest");
        }
        if (score.breakdown().health().ageScore() < YOUNG_POOL_AGE_SCORE) {
            risks.add("Relatively new pool: limited history");
        }
        if (risks.isEmpty()) {
            risks.add("General DeFi market risks (smart contract, exploits)");
        }
        return risks;
    }

    /** 1.2M, 450.0K, 950. */
    public static String formatUsd(double value) {
        if (value >= 1_000_000) return String.format(Locale.ROOT, "%.1fM", value / 1_000_000);
        if (value >= 1_000) return String.format(Locale.ROOT, "%.1fK", value / 1_000);
        return String.format(Locale.ROOT, "%.0f", value);
    }
}
