package com.poolintelligence.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PricePoint(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("price") double price
) {
    public static PricePoint of(Instant timestamp, double price) {
        return new PricePoint(timestamp, price);
    }
}
