package com.poolintelligence.common.health;

import com.poolintelligence.common.model.PoolType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link HealthScorer}: component maps, gates and bounds.
 */
class HealthScorerTest {

    private static HealthInput input(double tvl, Double vol1h, Double fees1h, double volAnn,
                                     PoolType type, Double apr, List<String> warnings) {
        return new HealthInput(tvl, vol1h, fees1h, volAnn, type, Duration.ZERO, apr, warnings);
    }

    @Nested
    @DisplayName("component scores")
    class ComponentTests {

        @Test
        @DisplayName("tvlScore maps $10K → 0 and $100M → 1")
        void tvlScore() {
            assertEquals(0.0, HealthScorer.calcHealthScore(input(10_000, null, null, 0.2, PoolType.CL, null, null))
                .breakdown().tvlScore(), 1e-12);
            assertEquals(1.0, HealthScorer.calcHealthScore(input(100_000_000, null, null, 0.2, PoolType.CL, null, null))
                .breakdown().tvlScore(), 1e-12);
        }

        @Test
        @DisplayName("stability threshold is 0.35 for STABLE and 1.20 otherwise")
        void stabilityThreshold() {
            HealthBreakdown stable = HealthScorer.calcHealthScore(
                input(1e6, null, null, 0.05, PoolType.STABLE, null, null)).breakdown();
            HealthBreakdown cl = HealthScorer.calcHealthScore(
                input(1e6, null, null, 0.05, PoolType.CL, null, null)).breakdown();
            assertEquals(1 - 0.05 / 0.35, stable.stabilityScore(), 1e-12);
            assertEquals(1 - 0.05 / 1.20, cl.stabilityScore(), 1e-12);
        }

        @Test
        @DisplayName("freshness decays with age and a negative age counts as fresh")
        void freshness() {
            HealthInput old = new HealthInput(1e6, null, null, 0.2, PoolType.CL, Duration.ofMinutes(10), null, null);
            HealthInput skewed = new HealthInput(1e6, null, null, 0.2, PoolType.CL, Duration.ofMinutes(-5), null, null);
            assertEquals(Math.exp(-1), HealthScorer.calcHealthScore(old).breakdown().freshnessScore(), 1e-9);
            assertEquals(1.0, HealthScorer.calcHealthScore(skewed).breakdown().freshnessScore());
        }
    }

    @Nested
    @DisplayName("gates")
    class GateTests {

        @Test
        @DisplayName("severe keyword floors the flag factor to 0.35 regardless of moderate ones")
        void severeWins() {
            assertEquals(0.35, HealthScorer.riskFlagFactor(List.of("new pool", "Possible HONEYPOT")));
            assertEquals(0.35, HealthScorer.riskFlagFactor(List.of("Contract not verified")));
        }

        @Test
        @DisplayName("moderate keyword → 0.60, none → 1.00")
        void moderate() {
            assertEquals(0.60, HealthScorer.riskFlagFactor(List.of("token unverified")));
            assertEquals(0.60, HealthScorer.riskFlagFactor(List.of("Liquidity low", "new pool")));
            assertEquals(1.00, HealthScorer.riskFlagFactor(List.of("all good")));
        }

        @Test
        @DisplayName("spike trap: APR > 300% with 1h volume < $50K")
        void spikeTrap() {
            assertEquals(0.55, HealthScorer.calcHealthScore(
                input(1e6, 10_000.0, null, 0.2, PoolType.CL, 400.0, null)).breakdown().p4SpikeTrap());
            assertEquals(1.0, HealthScorer.calcHealthScore(
                input(1e6, 60_000.0, null, 0.2, PoolType.CL, 400.0, null)).breakdown().p4SpikeTrap());
            assertEquals(1.0, HealthScorer.calcHealthScore(
                input(1e6, 10_000.0, null, 0.2, PoolType.CL, 250.0, null)).breakdown().p4SpikeTrap());
        }

        @Test
        @DisplayName("penaltyTotal never drops below 0.15")
        void penaltyFloor() {
            HealthScoreResult r = HealthScorer.calcHealthScore(
                input(0, 0.0, 0.0, 5.0, PoolType.CL, 1000.0, List.of("rug pull reported")));
            assertEquals(0.15, r.penaltyTotal(), 1e-12);
        }
    }

    @Test
    @DisplayName("score stays within [0, 100] across extreme inputs")
    void bounded() {
        double[] tvls = {0, 1, 1e4, 1e6, 1e9, 1e12};
        double[] vols = {0, 0.01, 1, 50};
        for (double tvl : tvls) {
            for (double v : vols) {
                HealthScoreResult r = HealthScorer.calcHealthScore(
                    input(tvl, tvl / 10, tvl, v, PoolType.CL, 5000.0, List.of()));
                assertTrue(r.score() >= 0 && r.score() <= 100, "score out of range: " + r.score());
                assertTrue(r.penaltyTotal() >= 0.15 && r.penaltyTotal() <= 1.0);
            }
        }
    }

    @Test
    @DisplayName("a deep, active, fresh pool scores high")
    void healthyPool() {
        HealthScoreResult r = HealthScorer.calcHealthScore(
            input(100_000_000, 10_000_000.0, 100_000.0, 0.0, PoolType.CL, 20.0, List.of()));
        assertEquals(100, r.score());
        assertEquals(1.0, r.penaltyTotal(), 1e-12);
    }

    @Test
    @DisplayName("ageOf() measures against the evaluation instant")
    void ageOf() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        assertEquals(Duration.ofMinutes(7), HealthScorer.ageOf(now.minusSeconds(420), now));
        assertEquals(Duration.ZERO, HealthScorer.ageOf(null, now));
    }
}
