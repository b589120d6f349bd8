package com.poolintelligence.common.stats;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric primitives shared by the calculators.
 * Pure functions, no state.
 */
public final class StatMath {

    // Abramowitz & Stegun 7.1.26 coefficients
    private static final double A1 =  0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 =  1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 =  1.061405429;
    private static final double P  =  0.3275911;

    private StatMath() {}

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Standard normal CDF via the Abramowitz–Stegun rational approximation of erf
     * (absolute error below 1.5e-7).
     */
    public static double normalCdf(double z) {
        double sign = z < 0 ? -1.0 : 1.0;
        double x = Math.abs(z) / Math.sqrt(2.0);
        double t = 1.0 / (1.0 + P * x);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-x * x);
        return 0.5 * (1.0 + sign * y);
    }

    /**
     * Sample standard deviation (n − 1 denominator).
     * @return 0.0 when fewer than two values are supplied
     */
    public static double sampleStdDev(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.size();
        double variance = 0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (values.size() - 1));
    }

    /**
     * Log-returns between consecutive prices, oldest-first.
     * Pairs where either side is non-positive are skipped.
     */
    public static List<Double> logReturns(List<Double> prices) {
        List<Double> returns = new ArrayList<>();
        if (prices == null) return returns;
        for (int i = 1; i < prices.size(); i++) {
            double prev = prices.get(i - 1);
            double curr = prices.get(i);
            if (prev > 0 && curr > 0) {
                returns.add(Math.log(curr / prev));
            }
        }
        return returns;
    }

    /** Rounds to the given number of decimal places (half-up on the scaled value). */
    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    public static boolean isPositive(Double value) {
        return value != null && value > 0;
    }
}
