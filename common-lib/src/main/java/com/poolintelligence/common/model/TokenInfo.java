package com.poolintelligence.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenInfo(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("decimals") int decimals,
    @JsonProperty("address") String address
) {
    public static TokenInfo of(String symbol) {
        return new TokenInfo(symbol, 18, null);
    }
}
