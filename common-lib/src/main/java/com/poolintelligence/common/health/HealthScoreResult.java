package com.poolintelligence.common.health;

import java.util.List;

/**
 * @param score        0–100
 * @param penaltyTotal product of the gates, clamped to [0.15, 1.0]
 */
public record HealthScoreResult(
    int score,
    double penaltyTotal,
    HealthBreakdown breakdown,
    List<String> warnings
) {}
