package com.poolintelligence.common.range;

import com.poolintelligence.common.model.RiskMode;

/**
 * Recommended LP band.
 *
 * <p>{@code lower}/{@code upper} are the raw symmetric bounds. When a tick spacing was supplied
 * the tick fields hold the outward-snapped ticks and their prices, which always contain the raw bounds;
 * otherwise they are {@code null}.
 *
 * @param widthPct       symmetric half-width as a fraction of price
 * @param probOutOfRange two-sided tail approximation in [0,1]
 */
public record RangeResult(
    double lower,
    double upper,
    double widthPct,
    Integer lowerTick,
    Integer upperTick,
    Double lowerTickPrice,
    Double upperTickPrice,
    double probOutOfRange,
    RiskMode mode,
    double horizonDays
) {}
