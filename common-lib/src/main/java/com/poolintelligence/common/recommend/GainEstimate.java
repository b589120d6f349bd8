package com.poolintelligence.common.recommend;

/**
 * Expected 7-day return of a position.
 *
 * @param gainPercent percent of capital, 2 decimals
 * @param gainUsd     USD on the supplied capital, 2 decimals
 */
public record GainEstimate(double gainPercent, double gainUsd) {}
