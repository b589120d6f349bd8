package com.poolintelligence.common.yield;

/**
 * Fee-APR estimation from sparse fee windows.
 *
 * <h3>Fallback chain</h3>
 * <pre>
 *   fees24h &gt; 0  → fees24h
 *   fees1h  &gt; 0  → fees1h × 24
 *   fees5m  &gt; 0  → fees5m × 288
 *   otherwise     → no data (APR null, source ESTIMATED)
 *   APR = fees24hEquivalent / TVL × 365 × 100
 * </pre>
 * TVL ≤ 0 always yields no data. Never throws.
 */
public final class FeeAprCalculator {

    static final double HOURS_PER_DAY        = 24.0;
    static final double FIVE_MIN_SLOTS_PER_DAY = 24.0 * 60.0 / 5.0;
    private static final double DAYS_PER_YEAR = 365.0;

    private FeeAprCalculator() {}

    public static AprResult calcAprFee(Double fees24h, Double fees1h, Double fees5m, double tvl) {
        if (!(tvl > 0) || Double.isInfinite(tvl)) {
            return AprResult.noData();
        }
        if (usable(fees24h)) {
            return new AprResult(annualize(fees24h, tvl), FeeSource.FEES_24H, fees24h);
        }
        if (usable(fees1h)) {
            double est = fees1h * HOURS_PER_DAY;
            return new AprResult(annualize(est, tvl), FeeSource.FEES_1H, est);
        }
        if (usable(fees5m)) {
            double est = fees5m * FIVE_MIN_SLOTS_PER_DAY;
            return new AprResult(annualize(est, tvl), FeeSource.FEES_5M, est);
        }
        return AprResult.noData();
    }

    /**
     * Discounts headline APR by the health penalty so an illiquid or flagged pool cannot
     * display an attractive unadjusted yield.
     */
    public static double calcAprAdjusted(double aprTotal, double penaltyTotal) {
        return aprTotal * penaltyTotal;
    }

    private static double annualize(double fees24h, double tvl) {
        return (fees24h / tvl) * DAYS_PER_YEAR * 100.0;
    }

    private static boolean usable(Double fees) {
        return fees != null && fees > 0 && !fees.isInfinite();
    }
}
