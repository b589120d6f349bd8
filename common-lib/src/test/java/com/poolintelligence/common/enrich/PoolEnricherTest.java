package com.poolintelligence.common.enrich;

import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.score.Score;
import com.poolintelligence.common.score.ScoreComposer;
import com.poolintelligence.common.score.ScoreInput;
import com.poolintelligence.common.yield.VolatilityEstimate;
import com.poolintelligence.common.yield.VolatilityMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolEnricherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Nested
    @DisplayName("inferPoolType() and isBluechip()")
    class ClassificationTests {

        @Test
        @DisplayName("two stable tokens → STABLE, case-insensitive")
        void stable() {
            assertEquals(PoolType.STABLE, PoolEnricher.inferPoolType("usdc", "crvUSD", "curve", null));
        }

        @Test
        @DisplayName("v2 and sushi protocols → V2 even with a fee tier")
        void v2() {
            assertEquals(PoolType.V2, PoolEnricher.inferPoolType("WETH", "PEPE", "uniswap-v2", 0.003));
            assertEquals(PoolType.V2, PoolEnricher.inferPoolType("WETH", "PEPE", "SushiSwap", 0.003));
        }

        @Test
        @DisplayName("fee tier → CL, otherwise V2")
        void feeTier() {
            assertEquals(PoolType.CL, PoolEnricher.inferPoolType("WETH", "USDC", "uniswap-v3", 0.0005));
            assertEquals(PoolType.V2, PoolEnricher.inferPoolType("WETH", "USDC", "balancer", null));
        }

        @Test
        @DisplayName("bluechip requires both tokens in the set")
        void bluechip() {
            assertTrue(PoolEnricher.isBluechip("weth", "USDC"));
            assertFalse(PoolEnricher.isBluechip("WETH", "PEPE"));
            assertFalse(PoolEnricher.isBluechip(null, "USDC"));
        }
    }

    @Nested
    @DisplayName("enrich()")
    class EnrichTests {

        @Test
        @DisplayName("fee APR wins over provider APR")
        void aprTotalFromFees() {
            PoolSnapshot pool = PoolSnapshot.builder("ethereum", "0xa")
                .tokens("WETH", "USDC").tvl(1_000_000).fees24h(100.0).apr(50.0).updatedAt(NOW).build();
            EnrichedPool e = PoolEnricher.enrich(pool, null, List.of(), NOW);
            assertEquals(3.65, e.aprTotal(), 1e-9);
            assertEquals(e.aprTotal() * e.health().penaltyTotal(), e.aprAdjusted(), 1e-12);
        }

        @Test
        @DisplayName("provider APR is used when no fee window is usable; no APR at all → null")
        void aprFallback() {
            PoolSnapshot withApr = PoolSnapshot.builder("ethereum", "0xa").tvl(1_000_000).apr(12.0).build();
            PoolSnapshot without = PoolSnapshot.builder("ethereum", "0xb").tvl(1_000_000).build();
            assertEquals(12.0, PoolEnricher.enrich(withApr, null, null, NOW).aprTotal());
            assertNull(PoolEnricher.enrich(without, null, null, NOW).aprTotal());
            assertNull(PoolEnricher.enrich(without, null, null, NOW).aprAdjusted());
        }

        @Test
        @DisplayName("volatility: measured, then 1h proxy, then 0.20 default")
        void volatilityResolution() {
            PoolSnapshot withPrices = PoolSnapshot.builder("ethereum", "0xa")
                .tvl(1_000_000).price(100.5).price1hAgo(100.0).build();
            PoolSnapshot bare = PoolSnapshot.builder("ethereum", "0xb").tvl(1_000_000).build();

            EnrichedPool measured = PoolEnricher.enrich(withPrices,
                new VolatilityEstimate(0.42, VolatilityMethod.LOG_RETURNS, 48), null, NOW);
            assertEquals(VolatilityOrigin.MEASURED, measured.volatilityOrigin());
            assertEquals(0.42, measured.scoringVolatility());

            EnrichedPool proxy = PoolEnricher.enrich(withPrices, null, null, NOW);
            assertEquals(VolatilityOrigin.PROXY, proxy.volatilityOrigin());
            assertEquals(Math.log(100.5 / 100.0) * Math.sqrt(8760), proxy.volatilityAnn(), 1e-12);

            EnrichedPool fallback = PoolEnricher.enrich(bare, null, null, NOW);
            assertEquals(VolatilityOrigin.DEFAULT, fallback.volatilityOrigin());
            assertEquals(PoolEnricher.DEFAULT_VOLATILITY, fallback.volatilityAnn());
            assertNull(fallback.scoringVolatility());
        }

        @Test
        @DisplayName("explicit pool type and bluechip flag are kept")
        void explicitFields() {
            PoolSnapshot pool = PoolSnapshot.builder("ethereum", "0xa")
                .tokens("FOO", "BAR").tvl(1_000_000).poolType(PoolType.STABLE).bluechip(true).build();
            EnrichedPool e = PoolEnricher.enrich(pool, null, null, NOW);
            assertEquals(PoolType.STABLE, e.poolType());
            assertTrue(e.bluechip());
        }

        @Test
        @DisplayName("honeypot warning drags health and is detectable")
        void honeypot() {
            PoolSnapshot pool = PoolSnapshot.builder("ethereum", "0xa")
                .tokens("WETH", "USDC").tvl(5_000_000).volume1h(200_000.0).fees1h(100.0).updatedAt(NOW).build();
            EnrichedPool clean = PoolEnricher.enrich(pool, null, List.of(), NOW);
            EnrichedPool flagged = PoolEnricher.enrich(pool, null, List.of("Honeypot suspected"), NOW);
            assertTrue(flagged.health().score() < clean.health().score());
            assertTrue(flagged.hasWarning("honeypot"));
            assertFalse(clean.hasWarning("honeypot"));
        }

        @Test
        @DisplayName("capital efficiency = volume1h / TVL")
        void capitalEfficiency() {
            PoolSnapshot pool = PoolSnapshot.builder("ethereum", "0xa").tvl(1_000_000).volume1h(50_000.0).build();
            assertEquals(0.05, PoolEnricher.enrich(pool, null, null, NOW).capitalEfficiency(), 1e-12);
        }
    }

    @Test
    @DisplayName("STABLE $50M pool with 5% volatility: high stability, never AGGRESSIVE")
    void stablePoolEndToEnd() {
        PoolSnapshot pool = PoolSnapshot.builder("ethereum", "0xstable")
            .protocol("curve")
            .tokens("USDC", "USDT")
            .tvl(50_000_000)
            .volume24h(5_000_000.0)
            .volume1h(400_000.0)
            .fees24h(10_000.0)
            .fees1h(400.0)
            .apr(7.0)
            .updatedAt(NOW)
            .build();
        EnrichedPool e = PoolEnricher.enrich(pool,
            new VolatilityEstimate(0.05, VolatilityMethod.LOG_RETURNS, 24), List.of(), NOW);

        assertEquals(PoolType.STABLE, e.poolType());
        assertTrue(e.health().breakdown().stabilityScore() > 0.85);
        assertTrue(e.health().breakdown().tvlScore() > 0.9);

        Score score = ScoreComposer.withDefaults().compose(
            ScoreInput.of(pool, e.poolType(), e.bluechip(), e.scoringVolatility(), e.aprTotal()));
        assertNotEquals(RiskMode.AGGRESSIVE, score.recommendedMode());
        assertFalse(score.suspect());
    }
}
