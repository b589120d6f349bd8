package com.poolintelligence.common.execution;

import com.poolintelligence.common.model.PoolType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionCostEstimatorTest {

    @Nested
    @DisplayName("price impact per pool type")
    class ImpactTests {

        @Test
        @DisplayName("STABLE assumes 10× depth")
        void stable() {
            ExecutionCostResult r = ExecutionCostEstimator.calculate(1_000_000, 500_000, PoolType.STABLE);
            assertEquals(0.01, r.impact1000(), 1e-9);
            assertEquals(0, r.executionCostPenalty());
            assertTrue(r.reason().startsWith("Deep liquidity"));
        }

        @Test
        @DisplayName("V2 uses the constant-product approximation")
        void v2() {
            ExecutionCostResult r = ExecutionCostEstimator.calculate(80_000, 50_000, PoolType.V2);
            assertEquals(0.0625, r.impact100(), 1e-9);
            assertEquals(0.625, r.impact1000(), 1e-9);
            assertEquals(4, r.executionCostPenalty());
            assertTrue(r.reason().startsWith("Moderate depth"));
        }

        @Test
        @DisplayName("CL concentration is clamped to [1, 10]")
        void clConcentration() {
            // turnover 1.0 · 20 = 20 → 10
            assertEquals(0.01, ExecutionCostEstimator.calculate(1_000_000, 1_000_000, PoolType.CL).impact1000(), 1e-9);
            // no volume → turnover 0.01 · 20 = 0.2 → 1
            ExecutionCostResult thin = ExecutionCostEstimator.calculate(100_000, 0, PoolType.CL);
            assertEquals(1.0, thin.impact1000(), 1e-9);
            assertEquals(6, thin.executionCostPenalty());
            assertTrue(thin.reason().startsWith("Thin liquidity"));
        }

        @Test
        @DisplayName("unknown type falls back to V2")
        void unknownType() {
            assertEquals(
                ExecutionCostEstimator.calculate(100_000, 50_000, PoolType.V2).impact1000(),
                ExecutionCostEstimator.calculate(100_000, 50_000, null).impact1000());
        }

        @Test
        @DisplayName("zero TVL → impact 100%, maximum penalty")
        void zeroTvl() {
            for (PoolType type : PoolType.values()) {
                ExecutionCostResult r = ExecutionCostEstimator.calculate(0, 1_000, type);
                assertEquals(100.0, r.impact1000());
                assertEquals(ExecutionCostEstimator.MAX_PENALTY, r.executionCostPenalty());
            }
        }
    }

    @Test
    @DisplayName("impact1000 ≥ impact100 for every pool")
    void ordering() {
        double[] tvls = {0, 1_000, 50_000, 1e6, 1e9};
        double[] volumes = {0, 1_000, 1e6};
        for (PoolType type : PoolType.values()) {
            for (double tvl : tvls) {
                for (double vol : volumes) {
                    ExecutionCostResult r = ExecutionCostEstimator.calculate(tvl, vol, type);
                    assertTrue(r.impact1000() >= r.impact100(), type + " tvl=" + tvl + " vol=" + vol);
                }
            }
        }
    }

    @Test
    @DisplayName("penalty ladder boundaries")
    void ladder() {
        assertEquals(0, ExecutionCostEstimator.impactToPenalty(0.099));
        assertEquals(2, ExecutionCostEstimator.impactToPenalty(0.1));
        assertEquals(4, ExecutionCostEstimator.impactToPenalty(0.5));
        assertEquals(6, ExecutionCostEstimator.impactToPenalty(1));
        assertEquals(8, ExecutionCostEstimator.impactToPenalty(3));
        assertEquals(10, ExecutionCostEstimator.impactToPenalty(5));
    }
}
