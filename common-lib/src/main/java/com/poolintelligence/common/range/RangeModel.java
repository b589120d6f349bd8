package com.poolintelligence.common.range;

import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.stats.StatMath;
import com.poolintelligence.common.yield.AprResult;
import com.poolintelligence.common.yield.FeeAprCalculator;

import java.util.Objects;

/**
 * Log-normal range width, tick alignment, out-of-range probability and fee-share estimate.
 *
 * <h3>Range</h3>
 * <pre>
 *   widthPct = clamp(z(mode) · σ · √(horizonDays/365), 0.003, 0.45)   (STABLE: min(widthPct, cap))
 *   lower = price·(1 − widthPct)      upper = price·(1 + widthPct)
 * </pre>
 *
 * <h3>Out-of-range probability</h3>
 * <pre>
 *   d = ln(upper/price) / (σ·√T)       P(out) = clamp(2·(1 − Φ(d)), 0, 1)
 * </pre>
 * Only the upper bound is used and the tail is doubled. That is exact only for a band symmetric
 * in log-price, which {@code price·(1 ± w)} is not, and snapping moves it further; kept as is
 * until the model is recalibrated.
 *
 * <h3>Fees</h3>
 * <pre>
 *   expectedFees24h = fees24hEquivalent · (capital/TVL) · activeFraction(mode)
 * </pre>
 *
 * <p>Immutable and thread-safe. Tables come from {@link RiskModeTable}.
 */
public final class RangeModel {

    static final double MIN_WIDTH = 0.003;
    static final double MAX_WIDTH = 0.45;
    static final double TICK_BASE = 1.0001;
    static final double DAYS_PER_YEAR = 365.0;

    private static final double LOG_TICK_BASE = Math.log(TICK_BASE);

    private final RiskModeTable table;

    public RangeModel(RiskModeTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static RangeModel withDefaults() {
        return new RangeModel(RiskModeTable.defaults());
    }

    public RiskModeTable table() {
        return table;
    }

    public RangeResult recommendRange(double price, double volAnn, double horizonDays,
                                      RiskMode mode, Integer tickSpacing, PoolType poolType) {
        requirePrice(price, "price");
        requireHorizon(horizonDays);
        requireVolatility(volAnn);
        Objects.requireNonNull(mode, "mode");

        double sqrtT = Math.sqrt(horizonDays / DAYS_PER_YEAR);
        double widthPct = StatMath.clamp(table.zScore(mode) * volAnn * sqrtT, MIN_WIDTH, MAX_WIDTH);
        if (poolType == PoolType.STABLE) {
            widthPct = Math.min(widthPct, table.stableWidthCap());
        }

        double lower = price * (1 - widthPct);
        double upper = price * (1 + widthPct);
        double probOut = upperTailProbability(price, upper, volAnn, sqrtT);

        Integer lowerTick = null;
        Integer upperTick = null;
        Double lowerTickPrice = null;
        Double upperTickPrice = null;
        if (tickSpacing != null && tickSpacing > 0 && lower > 0 && upper > 0) {
            lowerTick = snapLowerTick(lower, tickSpacing);
            upperTick = snapUpperTick(upper, tickSpacing);
            lowerTickPrice = tickToPrice(lowerTick);
            upperTickPrice = tickToPrice(upperTick);
        }

        return new RangeResult(lower, upper, widthPct, lowerTick, upperTick,
            lowerTickPrice, upperTickPrice, probOut, mode, horizonDays);
    }

    public FeeEstimate estimateUserFees(double tvl, Double fees24h, Double fees1h, Double fees5m,
                                        double userCapital, RiskMode mode) {
        if (!(userCapital >= 0) || Double.isInfinite(userCapital)) {
            throw new IllegalArgumentException("userCapital must be a finite non-negative number: " + userCapital);
        }
        Objects.requireNonNull(mode, "mode");

        double activeFraction = table.activeFraction(mode);
        double share = tvl > 0 ? userCapital / tvl : 0.0;

        AprResult apr = FeeAprCalculator.calcAprFee(fees24h, fees1h, fees5m, tvl);
        double fees24hUsd = apr.fees24hUsd() != null ? apr.fees24hUsd() : 0.0;

        double expected24h = fees24hUsd * share * activeFraction;
        return new FeeEstimate(expected24h, expected24h * 7, expected24h * 30, share, activeFraction);
    }

    public IlRiskResult calcIlRisk(double price, double rangeLower, double rangeUpper,
                                   double volAnn, double horizonDays) {
        requirePrice(price, "price");
        requireHorizon(horizonDays);
        requireVolatility(volAnn);

        double sqrtT = Math.sqrt(horizonDays / DAYS_PER_YEAR);
        double probOut = rangeUpper > price ? upperTailProbability(price, rangeUpper, volAnn, sqrtT) : 0.0;
        return new IlRiskResult(probOut, probOut, horizonDays);
    }

    // ── ticks ────────────────────────────────────────────────────────────────

    public static int priceToTick(double price) {
        return (int) Math.floor(Math.log(price) / LOG_TICK_BASE);
    }

    public static double tickToPrice(int tick) {
        return Math.pow(TICK_BASE, tick);
    }

    /** Largest spacing-aligned tick whose price does not exceed {@code lower}. */
    static int snapLowerTick(double lower, int spacing) {
        int tick = Math.floorDiv(priceToTick(lower), spacing) * spacing;
        while (tickToPrice(tick) > lower) {
            tick -= spacing;
        }
        return tick;
    }

    /** Smallest spacing-aligned tick whose price is not below {@code upper}. */
    static int snapUpperTick(double upper, int spacing) {
        int rawCeil = (int) Math.ceil(Math.log(upper) / LOG_TICK_BASE);
        int tick = -Math.floorDiv(-rawCeil, spacing) * spacing;
        while (tickToPrice(tick) < upper) {
            tick += spacing;
        }
        return tick;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static double upperTailProbability(double price, double upper, double sigma, double sqrtT) {
        if (!(sigma > 0) || !(sqrtT > 0)) return 0.0;
        double dUpper = Math.log(upper / price) / (sigma * sqrtT);
        return StatMath.clamp(2 * (1 - StatMath.normalCdf(dUpper)), 0, 1);
    }

    private static void requirePrice(double price, String name) {
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException(name + " must be a finite positive number: " + price);
        }
    }

    private static void requireHorizon(double horizonDays) {
        if (!(horizonDays >= 0) || Double.isInfinite(horizonDays)) {
            throw new IllegalArgumentException("horizonDays must be finite and non-negative: " + horizonDays);
        }
    }

    private static void requireVolatility(double volAnn) {
        if (!(volAnn >= 0) || Double.isInfinite(volAnn)) {
            throw new IllegalArgumentException("volAnn must be finite and non-negative: " + volAnn);
        }
    }
}
