package com.poolintelligence.scoring.dto;

public record IngestResponse(String poolId, int registeredPools) {}
