package com.poolintelligence.common.score;

import com.poolintelligence.common.model.RiskMode;

import java.util.List;

/**
 * Composite pool score. Produced fresh on every call and never mutated.
 *
 * @param total          0–100
 * @param suspect        the score is low-confidence; reasons are accumulated, not first-match
 */
public record Score(
    double total,
    double health,
    double ret,
    double risk,
    ScoreBreakdown breakdown,
    RiskMode recommendedMode,
    boolean suspect,
    List<String> suspectReasons
) {}
