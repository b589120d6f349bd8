package com.poolintelligence.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

/** TVL and 24h volume for one pool as reported by one data provider. */
public record SourceMetrics(
    @JsonProperty("source") String source,
    @JsonProperty("poolAddress") String poolAddress,
    @JsonProperty("tvl") double tvl,
    @JsonProperty("volume24h") double volume24h
) {}
