package com.poolintelligence.common.enrich;

import com.poolintelligence.common.health.HealthInput;
import com.poolintelligence.common.health.HealthScoreResult;
import com.poolintelligence.common.health.HealthScorer;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.TokenInfo;
import com.poolintelligence.common.stats.StatMath;
import com.poolintelligence.common.yield.AprResult;
import com.poolintelligence.common.yield.FeeAprCalculator;
import com.poolintelligence.common.yield.VolatilityEstimate;
import com.poolintelligence.common.yield.VolatilityEstimator;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives pool type, bluechip status, APR, volatility and health for a raw snapshot.
 *
 * <h3>Volatility resolution</h3>
 * <pre>
 *   measured series (≥ 3 points)        → MEASURED
 *   price and price1hAgo both positive  → PROXY    (|ln(now/ago)|·√8760, clamped [0.05, 3])
 *   otherwise                           → DEFAULT  (0.20)
 * </pre>
 */
public final class PoolEnricher {

    public static final double DEFAULT_VOLATILITY = 0.20;

    static final Set<String> STABLE_TOKENS = Set.of(
        "USDC", "USDT", "DAI", "FRAX", "LUSD", "GUSD", "USDP", "BUSD", "TUSD", "CRVUSD");

    static final Set<String> BLUECHIP_TOKENS = Set.of(
        "ETH", "WETH", "BTC", "WBTC", "USDC", "USDT", "DAI", "LINK", "UNI", "ARB", "OP",
        "MATIC", "WMATIC", "SOL", "AVAX", "BNB", "AAVE", "CRV", "LDO", "MKR", "COMP", "SNX");

    private PoolEnricher() {}

    /**
     * Both tokens stable → STABLE; a v2-style protocol → V2; a fee tier → CL; otherwise V2.
     */
    public static PoolType inferPoolType(String symbol0, String symbol1, String protocol, Double feeTier) {
        if (isIn(symbol0, STABLE_TOKENS) && isIn(symbol1, STABLE_TOKENS)) return PoolType.STABLE;
        String p = protocol != null ? protocol.toLowerCase(Locale.ROOT) : "";
        if (p.contains("v2") || p.contains("sushi")) return PoolType.V2;
        if (feeTier != null) return PoolType.CL;
        return PoolType.V2;
    }

    public static boolean isBluechip(String symbol0, String symbol1) {
        return isIn(symbol0, BLUECHIP_TOKENS) && isIn(symbol1, BLUECHIP_TOKENS);
    }

    /**
     * @param measured  volatility from a price series, may be {@code null}
     * @param warnings  free-text risk warnings, may be {@code null}
     * @param now       evaluation instant; the snapshot's age is measured against it
     */
    public static EnrichedPool enrich(PoolSnapshot pool, VolatilityEstimate measured,
                                      List<String> warnings, Instant now) {
        List<String> safeWarnings = warnings != null ? List.copyOf(warnings) : List.of();
        String symbol0 = symbol(pool.token0());
        String symbol1 = symbol(pool.token1());

        PoolType poolType = pool.poolType() != null
            ? pool.poolType()
            : inferPoolType(symbol0, symbol1, pool.protocol(), pool.feeTier());
        boolean bluechip = pool.bluechip() != null ? pool.bluechip() : isBluechip(symbol0, symbol1);

        AprResult feeApr = FeeAprCalculator.calcAprFee(pool.fees24h(), pool.fees1h(), pool.fees5m(), pool.tvl());
        Double aprTotal = feeApr.hasApr() ? feeApr.feeApr() : pool.apr();

        VolatilityOrigin origin;
        double volatility;
        if (measured != null && measured.isMeasured()) {
            origin = VolatilityOrigin.MEASURED;
            volatility = measured.volAnn();
        } else if (StatMath.isPositive(pool.price()) && StatMath.isPositive(pool.price1hAgo())) {
            origin = VolatilityOrigin.PROXY;
            volatility = VolatilityEstimator.calcVolatilityProxy(pool.price(), pool.price1hAgo()).volAnn();
        } else {
            origin = VolatilityOrigin.DEFAULT;
            volatility = DEFAULT_VOLATILITY;
        }

        Instant updatedAt = pool.updatedAt() != null ? pool.updatedAt() : now;
        HealthScoreResult health = HealthScorer.calcHealthScore(new HealthInput(
            pool.tvl(),
            pool.volume1h(),
            pool.fees1h(),
            volatility,
            poolType,
            HealthScorer.ageOf(updatedAt, now),
            aprTotal,
            safeWarnings));

        Double aprAdjusted = aprTotal != null
            ? FeeAprCalculator.calcAprAdjusted(aprTotal, health.penaltyTotal())
            : null;
        double capitalEfficiency = pool.tvl() > 0 && pool.volume1h() != null ? pool.volume1h() / pool.tvl() : 0.0;

        return new EnrichedPool(pool, poolType, bluechip, feeApr, aprTotal, aprAdjusted,
            volatility, origin, health, capitalEfficiency, safeWarnings, now);
    }

    private static String symbol(TokenInfo token) {
        return token != null ? token.symbol() : null;
    }

    private static boolean isIn(String symbol, Set<String> set) {
        return symbol != null && set.contains(symbol.toUpperCase(Locale.ROOT));
    }
}
