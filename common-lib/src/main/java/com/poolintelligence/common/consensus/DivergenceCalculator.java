package com.poolintelligence.common.consensus;

/**
 * Divergence between two provider readings and its penalty ladder.
 *
 * <pre>
 *   both ≤ 0        → 0
 *   exactly one ≤ 0 → 100   (one source claims no data while the other reports some)
 *   otherwise       → (max − min) / max × 100
 *
 *   divergence ≤ 10 → 0
 *              ≤ 20 → 3
 *              ≤ 30 → 7
 *              ≤ 50 → 10
 *              else → 15
 * </pre>
 */
public final class DivergenceCalculator {

    public static final int MAX_PENALTY = 15;

    /** Divergence at or below this is treated as normal provider variance. */
    public static final double AGREEMENT_THRESHOLD = 10.0;

    private DivergenceCalculator() {}

    public static double calcDivergence(double a, double b) {
        if (a <= 0 && b <= 0) return 0.0;
        if (a <= 0 || b <= 0) return 100.0;
        double max = Math.max(a, b);
        double min = Math.min(a, b);
        return ((max - min) / max) * 100.0;
    }

    public static int divergenceToPenalty(double divergence) {
        if (divergence <= 10) return 0;
        if (divergence <= 20) return 3;
        if (divergence <= 30) return 7;
        if (divergence <= 50) return 10;
        return MAX_PENALTY;
    }
}
