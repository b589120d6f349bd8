package com.poolintelligence.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * One observation of a pool, produced by the external collector.
 *
 * <p>Immutable and read-only to every calculator. Optional metrics are boxed and may be
 * {@code null}; a new observation is always a new snapshot.
 *
 * <ul>
 *   <li>{@code feeTier}:     decimal fraction, e.g. {@code 0.003} for a 0.3% pool</li>
 *   <li>{@code price1hAgo}:  optional, feeds the single-sample volatility proxy</li>
 *   <li>{@code apr}:         provider-reported APR in percent, used when fees are missing</li>
 *   <li>{@code poolType}:    may be {@code null}; inferred during enrichment</li>
 *   <li>{@code bluechip}:    may be {@code null}; derived from token symbols during enrichment</li>
 * </ul>
 */
public record PoolSnapshot(
    @JsonProperty("chainId") String chainId,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("poolAddress") String poolAddress,
    @JsonProperty("token0") TokenInfo token0,
    @JsonProperty("token1") TokenInfo token1,
    @JsonProperty("feeTier") Double feeTier,
    @JsonProperty("price") Double price,
    @JsonProperty("price1hAgo") Double price1hAgo,
    @JsonProperty("tvl") double tvl,
    @JsonProperty("volume24h") Double volume24h,
    @JsonProperty("volume1h") Double volume1h,
    @JsonProperty("volume5m") Double volume5m,
    @JsonProperty("fees24h") Double fees24h,
    @JsonProperty("fees1h") Double fees1h,
    @JsonProperty("fees5m") Double fees5m,
    @JsonProperty("apr") Double apr,
    @JsonProperty("poolType") PoolType poolType,
    @JsonProperty("tickSpacing") Integer tickSpacing,
    @JsonProperty("bluechip") Boolean bluechip,
    @JsonProperty("updatedAt") Instant updatedAt
) {

    /** Stable key used by the registries and the TVL tracker: {@code <chain>_<address>}. */
    @JsonIgnore
    public String poolId() {
        return poolId(chainId, poolAddress);
    }

    public static String poolId(String chainId, String poolAddress) {
        String address = poolAddress == null ? "" : poolAddress.toLowerCase(Locale.ROOT);
        return chainId + "_" + address;
    }

    /** 24h volume with {@code null} read as zero. */
    @JsonIgnore
    public double volume24hOrZero() {
        return volume24h != null ? volume24h : 0.0;
    }

    @JsonIgnore
    public String pairLabel() {
        String s0 = token0 != null ? token0.symbol() : "?";
        String s1 = token1 != null ? token1.symbol() : "?";
        return s0 + "/" + s1;
    }

    public static Builder builder(String chainId, String poolAddress) {
        return new Builder(chainId, poolAddress);
    }

    /** Fluent builder; the record has too many optional components for positional construction. */
    public static final class Builder {
        private final String chainId;
        private final String poolAddress;
        private String protocol;
        private TokenInfo token0 = TokenInfo.of("TOKEN0");
        private TokenInfo token1 = TokenInfo.of("TOKEN1");
        private Double feeTier;
        private Double price;
        private Double price1hAgo;
        private double tvl;
        private Double volume24h;
        private Double volume1h;
        private Double volume5m;
        private Double fees24h;
        private Double fees1h;
        private Double fees5m;
        private Double apr;
        private PoolType poolType;
        private Integer tickSpacing;
        private Boolean bluechip;
        private Instant updatedAt;

        private Builder(String chainId, String poolAddress) {
            this.chainId = chainId;
            this.poolAddress = poolAddress;
        }

        public Builder protocol(String protocol)       { this.protocol = protocol; return this; }
        public Builder tokens(String symbol0, String symbol1) {
            this.token0 = TokenInfo.of(symbol0);
            this.token1 = TokenInfo.of(symbol1);
            return this;
        }
        public Builder tokens(TokenInfo token0, TokenInfo token1) {
            this.token0 = token0;
            this.token1 = token1;
            return this;
        }
        public Builder feeTier(Double feeTier)         { this.feeTier = feeTier; return this; }
        public Builder price(Double price)             { this.price = price; return this; }
        public Builder price1hAgo(Double price1hAgo)   { this.price1hAgo = price1hAgo; return this; }
        public Builder tvl(double tvl)                 { this.tvl = tvl; return this; }
        public Builder volume24h(Double volume24h)     { this.volume24h = volume24h; return this; }
        public Builder volume1h(Double volume1h)       { this.volume1h = volume1h; return this; }
        public Builder volume5m(Double volume5m)       { this.volume5m = volume5m; return this; }
        public Builder fees24h(Double fees24h)         { this.fees24h = fees24h; return this; }
        public Builder fees1h(Double fees1h)           { this.fees1h = fees1h; return this; }
        public Builder fees5m(Double fees5m)           { this.fees5m = fees5m; return this; }
        public Builder apr(Double apr)                 { this.apr = apr; return this; }
        public Builder poolType(PoolType poolType)     { this.poolType = poolType; return this; }
        public Builder tickSpacing(Integer tickSpacing) { this.tickSpacing = tickSpacing; return this; }
        public Builder bluechip(Boolean bluechip)      { this.bluechip = bluechip; return this; }
        public Builder updatedAt(Instant updatedAt)    { this.updatedAt = updatedAt; return this; }

        public PoolSnapshot build() {
            return new PoolSnapshot(chainId, protocol, poolAddress, token0, token1, feeTier, price,
                price1hAgo, tvl, volume24h, volume1h, volume5m, fees24h, fees1h, fees5m, apr,
                poolType, tickSpacing, bluechip, updatedAt);
        }
    }
}
