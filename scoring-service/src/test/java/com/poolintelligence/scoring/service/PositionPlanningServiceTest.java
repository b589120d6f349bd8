package com.poolintelligence.scoring.service;

import com.poolintelligence.common.exception.PoolIntelligenceException;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.scoring.dto.SnapshotIngestRequest;
import com.poolintelligence.scoring.exception.UnknownPoolException;
import com.poolintelligence.scoring.support.ScoringFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionPlanningServiceTest {

    private ScoringFixture fx;

    @BeforeEach
    void setUp() {
        fx = new ScoringFixture();
        fx.scoringService.ingest(fx.withHistory(fx.deepPool("0xdeep").build(), List.of()));
    }

    @Test
    @DisplayName("explicit mode, horizon and capital are honoured")
    void explicitInputs() {
        PositionPlan plan = fx.planningService.plan("ethereum_0xdeep", RiskMode.DEFENSIVE, 14.0, 10_000.0).block();

        assertEquals(RiskMode.DEFENSIVE, plan.mode());
        assertEquals(RiskMode.NORMAL, plan.recommendedMode());
        assertEquals(14.0, plan.horizonDays());
        assertEquals(10_000.0, plan.capitalUsd());
        assertEquals(RiskMode.DEFENSIVE, plan.range().mode());
        assertTrue(plan.range().lower() < 3000.0 && plan.range().upper() > 3000.0);
        assertEquals(0.001, plan.fees().userLiquidityShare(), 1e-12);
        assertEquals(plan.fees().expectedFees24h() * 7, plan.fees().expectedFees7d(), 1e-9);
    }

    @Test
    @DisplayName("no mode → the score's recommended mode with configured defaults")
    void defaults() {
        PositionPlan plan = fx.planningService.plan("ethereum_0xdeep", null, null, null).block();

        assertEquals(RiskMode.NORMAL, plan.mode());
        assertEquals(7.0, plan.horizonDays());
        assertEquals(1_000.0, plan.capitalUsd());
    }

    @Test
    @DisplayName("tick spacing on the snapshot → snapped ticks containing the raw band")
    void ticks() {
        PositionPlan plan = fx.planningService.plan("ethereum_0xdeep", RiskMode.NORMAL, null, null).block();

        assertNotNull(plan.range().lowerTick());
        assertNotNull(plan.range().upperTick());
        assertEquals(0, plan.range().lowerTick() % 10);
        assertEquals(0, plan.range().upperTick() % 10);
        assertTrue(plan.range().lowerTickPrice() <= plan.range().lower());
        assertTrue(plan.range().upperTickPrice() >= plan.range().upper());
    }

    @Test
    @DisplayName("IL risk is reported as a probability")
    void ilRisk() {
        PositionPlan plan = fx.planningService.plan("ethereum_0xdeep", RiskMode.AGGRESSIVE, null, null).block();

        assertTrue(plan.ilRisk().probOutOfRange() >= 0 && plan.ilRisk().probOutOfRange() <= 1);
        assertEquals(plan.ilRisk().probOutOfRange(), plan.ilRisk().ilRiskScore());
    }

    @Test
    @DisplayName("pool without a price cannot be planned")
    void noPrice() {
        fx.scoringService.ingest(SnapshotIngestRequest.of(fx.deepPool("0xnoprice").price(null).build()));

        PoolIntelligenceException e = assertThrows(PoolIntelligenceException.class,
            () -> fx.planningService.plan("ethereum_0xnoprice", null, null, null).block());
        assertEquals("position-planner", e.getComponent());
    }

    @Test
    @DisplayName("unknown pool → UnknownPoolException")
    void unknownPool() {
        assertThrows(UnknownPoolException.class,
            () -> fx.planningService.plan("ethereum_0xnope", null, null, null).block());
    }
}
