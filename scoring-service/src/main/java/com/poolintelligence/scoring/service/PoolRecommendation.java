package com.poolintelligence.scoring.service;

import com.poolintelligence.common.model.RiskMode;

import java.time.Instant;
import java.util.List;

/**
 * One ranked pool with its expected outcome on {@code capitalUsd}.
 *
 * @param probability          chance of a favourable scenario in percent, never above 85
 * @param estimatedGainPercent expected 7-day return in percent of capital
 * @param validUntil           24h after the assessment
 */
public record PoolRecommendation(
    int rank,
    String poolId,
    String pair,
    double score,
    RiskMode mode,
    String reason,
    int probability,
    double estimatedGainPercent,
    double estimatedGainUsd,
    double capitalUsd,
    List<String> entryConditions,
    List<String> exitConditions,
    List<String> mainRisks,
    Instant validUntil,
    PoolAssessment assessment
) {}
