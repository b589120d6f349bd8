package com.poolintelligence.common.yield;

import com.poolintelligence.common.model.PricePoint;
import com.poolintelligence.common.stats.StatMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Annualized volatility from a price history, or from a current / one-hour-ago price pair.
 *
 * <pre>
 *   series: σ(log-returns) × √periodsPerYear, clamped to [0.01, 10]
 *           needs ≥ 3 points and ≥ 2 returns, otherwise 0 / PROXY
 *   proxy:  |ln(now / 1hAgo)| × √(24·365), clamped to [0.05, 3.0]
 *           0 / PROXY when either price is non-positive
 * </pre>
 */
public final class VolatilityEstimator {

    static final int MIN_POINTS  = 3;
    static final int MIN_RETURNS = 2;

    static final double SERIES_MIN = 0.01;
    static final double SERIES_MAX = 10.0;
    static final double PROXY_MIN  = 0.05;
    static final double PROXY_MAX  = 3.0;

    private VolatilityEstimator() {}

    public static VolatilityEstimate calcVolatilityAnn(List<PricePoint> points, SamplingInterval interval) {
        if (points == null || points.size() < MIN_POINTS) {
            return VolatilityEstimate.notMeasured(points == null ? 0 : points.size());
        }

        List<PricePoint> sorted = new ArrayList<>();
        for (PricePoint p : points) {
            if (p != null && p.timestamp() != null && Double.isFinite(p.price())) sorted.add(p);
        }
        sorted.sort(Comparator.comparing(PricePoint::timestamp));

        List<Double> prices = new ArrayList<>(sorted.size());
        for (PricePoint p : sorted) prices.add(p.price());

        List<Double> returns = StatMath.logReturns(prices);
        if (returns.size() < MIN_RETURNS) {
            return VolatilityEstimate.notMeasured(points.size());
        }

        SamplingInterval effective = interval != null ? interval : SamplingInterval.HOURLY;
        double sigma = StatMath.sampleStdDev(returns);
        double volAnn = StatMath.clamp(sigma * Math.sqrt(effective.periodsPerYear()), SERIES_MIN, SERIES_MAX);
        return new VolatilityEstimate(volAnn, VolatilityMethod.LOG_RETURNS, points.size());
    }

    public static VolatilityEstimate calcVolatilityProxy(double priceNow, double price1hAgo) {
        if (!(priceNow > 0) || !(price1hAgo > 0)
                || Double.isInfinite(priceNow) || Double.isInfinite(price1hAgo)) {
            return VolatilityEstimate.notMeasured(0);
        }
        double raw = Math.abs(Math.log(priceNow / price1hAgo)) * Math.sqrt(SamplingInterval.HOURLY.periodsPerYear());
        return new VolatilityEstimate(StatMath.clamp(raw, PROXY_MIN, PROXY_MAX), VolatilityMethod.PROXY, 2);
    }
}
