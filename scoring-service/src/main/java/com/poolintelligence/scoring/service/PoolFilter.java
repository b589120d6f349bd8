package com.poolintelligence.scoring.service;

import com.poolintelligence.common.enrich.EnrichedPool;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.TokenInfo;

import java.util.Locale;

/**
 * Optional criteria for listing pools; every {@code null} field matches everything.
 *
 * @param protocol  case-insensitive substring of the protocol name
 * @param token     case-insensitive substring of either token symbol
 * @param bluechip  {@code true} keeps only blue-chip pairs, otherwise ignored
 * @param minHealth minimum health score, 0–100
 */
public record PoolFilter(
    String chain,
    String protocol,
    String token,
    Boolean bluechip,
    Double minTvl,
    Integer minHealth,
    PoolType poolType
) {
    public static PoolFilter none() {
        return new PoolFilter(null, null, null, null, null, null, null);
    }

    public boolean matches(EnrichedPool pool) {
        PoolSnapshot s = pool.snapshot();
        if (chain != null && !chain.equals(s.chainId())) return false;
        if (protocol != null && (s.protocol() == null || !lower(s.protocol()).contains(lower(protocol)))) return false;
        if (token != null && !symbolContains(s.token0(), token) && !symbolContains(s.token1(), token)) return false;
        if (Boolean.TRUE.equals(bluechip) && !pool.bluechip()) return false;
        if (minTvl != null && s.tvl() < minTvl) return false;
        if (minHealth != null && pool.health().score() < minHealth) return false;
        return poolType == null || poolType == pool.poolType();
    }

    private static boolean symbolContains(TokenInfo token, String needle) {
        return token != null && token.symbol() != null && lower(token.symbol()).contains(lower(needle));
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
