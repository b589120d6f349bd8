package com.poolintelligence.common.enrich;

import com.poolintelligence.common.health.HealthScoreResult;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.yield.AprResult;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * A snapshot with the derived figures every downstream calculator needs.
 *
 * @param aprTotal         fee APR when computable, else the provider's APR; may be {@code null}
 * @param aprAdjusted      {@code aprTotal · penaltyTotal}; {@code null} alongside a null aprTotal
 * @param volatilityAnn    resolved volatility, never zero
 * @param capitalEfficiency volume1h / TVL, 0 when either is unknown
 */
public record EnrichedPool(
    PoolSnapshot snapshot,
    PoolType poolType,
    boolean bluechip,
    AprResult feeApr,
    Double aprTotal,
    Double aprAdjusted,
    double volatilityAnn,
    VolatilityOrigin volatilityOrigin,
    HealthScoreResult health,
    double capitalEfficiency,
    List<String> warnings,
    Instant evaluatedAt
) {
    /**
     * Volatility to score with: the measured or proxy value, {@code null} when only the
     * default was available. The composer treats {@code null} as unknown.
     */
    public Double scoringVolatility() {
        return volatilityOrigin == VolatilityOrigin.DEFAULT ? null : volatilityAnn;
    }

    public boolean hasWarning(String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        for (String w : warnings) {
            if (w != null && w.toLowerCase(Locale.ROOT).contains(needle)) return true;
        }
        return false;
    }
}
