package com.poolintelligence.common.range;

public record IlRiskResult(
    double probOutOfRange,
    double ilRiskScore,
    double horizonDays
) {}
