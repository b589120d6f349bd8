package com.poolintelligence.common.execution;

import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.stats.StatMath;

import java.util.Locale;

/**
 * AMM price-impact estimate for standard trade sizes, without a live quote.
 *
 * <pre>
 *   STABLE  impact = size / (10 · TVL) · 100
 *   CL      concentration = clamp(volume24h / TVL · 20, 1, 10)
 *           impact = size / (TVL · concentration) · 100
 *   V2      impact = size / (2 · TVL) · 100          (also used when the type is unknown)
 *   TVL ≤ 0 → 100%
 *
 *   penalty from the $1000 impact:
 *   &lt; 0.1 → 0, &lt; 0.5 → 2, &lt; 1 → 4, &lt; 3 → 6, &lt; 5 → 8, else 10
 * </pre>
 */
public final class ExecutionCostEstimator {

    public static final double SMALL_TRADE_USD = 100.0;
    public static final double LARGE_TRADE_USD = 1_000.0;
    public static final int MAX_PENALTY = 10;

    /** Turnover assumed for a CL pool that reports no volume. */
    static final double DEFAULT_CL_TURNOVER = 0.01;

    private ExecutionCostEstimator() {}

    public static ExecutionCostResult calculate(double tvl, double volume24h, PoolType poolType) {
        double impact100 = estimatePriceImpact(SMALL_TRADE_USD, tvl, volume24h, poolType);
        double impact1000 = estimatePriceImpact(LARGE_TRADE_USD, tvl, volume24h, poolType);
        int penalty = impactToPenalty(impact1000);

        String reason;
        if (penalty == 0) {
            reason = String.format(Locale.ROOT, "Deep liquidity — $1K impact %.3f%%", impact1000);
        } else if (penalty <= 4) {
            reason = String.format(Locale.ROOT, "Moderate depth — $1K impact %.2f%%", impact1000);
        } else {
            reason = String.format(Locale.ROOT, "Thin liquidity — $1K impact %.2f%%, $100 impact %.3f%%",
                impact1000, impact100);
        }

        return new ExecutionCostResult(
            StatMath.round(impact100, 4),
            StatMath.round(impact1000, 4),
            penalty,
            poolType,
            reason);
    }

    public static double estimatePriceImpact(double tradeSize, double tvl, double volume24h, PoolType poolType) {
        if (!(tvl > 0)) return 100.0;
        if (tradeSize <= 0) return 0.0;

        PoolType type = poolType != null ? poolType : PoolType.V2;
        return switch (type) {
            case STABLE -> (tradeSize / (10 * tvl)) * 100;
            case CL -> {
                double turnover = volume24h > 0 ? volume24h / tvl : DEFAULT_CL_TURNOVER;
                double concentration = StatMath.clamp(turnover * 20, 1, 10);
                yield (tradeSize / (tvl * concentration)) * 100;
            }
            case V2 -> (tradeSize / (2 * tvl)) * 100;
        };
    }

    public static int impactToPenalty(double impact) {
        if (impact < 0.1) return 0;
        if (impact < 0.5) return 2;
        if (impact < 1) return 4;
        if (impact < 3) return 6;
        if (impact < 5) return 8;
        return MAX_PENALTY;
    }
}
