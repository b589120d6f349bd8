package com.poolintelligence.scoring.service;

import com.poolintelligence.common.exception.PoolIntelligenceException;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.range.FeeEstimate;
import com.poolintelligence.common.range.IlRiskResult;
import com.poolintelligence.common.range.RangeModel;
import com.poolintelligence.common.range.RangeResult;
import com.poolintelligence.common.stats.StatMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Builds a range, fee and IL-risk plan on top of a fresh assessment.
 * The mode defaults to the score's recommendation.
 */
@Service
public class PositionPlanningService {

    private static final Logger log = LoggerFactory.getLogger(PositionPlanningService.class);

    private final PoolScoringService scoringService;
    private final RangeModel rangeModel;
    private final double defaultHorizonDays;
    private final double defaultCapitalUsd;

    public PositionPlanningService(PoolScoringService scoringService,
                                   RangeModel rangeModel,
                                   @Value("${scoring.planning.default-horizon-days:7}") double defaultHorizonDays,
                                   @Value("${scoring.planning.default-capital-usd:1000}") double defaultCapitalUsd) {
        this.scoringService = scoringService;
        this.rangeModel = rangeModel;
        this.defaultHorizonDays = defaultHorizonDays;
        this.defaultCapitalUsd = defaultCapitalUsd;
    }

    /**
     * @param mode        {@code null} uses the score's recommended mode
     * @param horizonDays {@code null} uses {@code scoring.planning.default-horizon-days}
     * @param capitalUsd  {@code null} uses {@code scoring.planning.default-capital-usd}
     */
    public Mono<PositionPlan> plan(String poolId, RiskMode mode, Double horizonDays, Double capitalUsd) {
        double horizon = horizonDays != null ? horizonDays : defaultHorizonDays;
        double capital = capitalUsd != null ? capitalUsd : defaultCapitalUsd;

        return scoringService.assess(poolId).map(assessment -> {
            PoolSnapshot snapshot = assessment.pool().snapshot();
            if (!StatMath.isPositive(snapshot.price())) {
                throw new PoolIntelligenceException("position-planner", "No usable price for pool " + poolId);
            }
            RiskMode recommended = assessment.score().recommendedMode();
            RiskMode chosen = mode != null ? mode : recommended;
            double price = snapshot.price();
            double volatility = assessment.pool().volatilityAnn();

            RangeResult range = rangeModel.recommendRange(price, volatility, horizon, chosen,
                snapshot.tickSpacing(), assessment.pool().poolType());
            FeeEstimate fees = rangeModel.estimateUserFees(snapshot.tvl(),
                snapshot.fees24h(), snapshot.fees1h(), snapshot.fees5m(), capital, chosen);
            IlRiskResult ilRisk = rangeModel.calcIlRisk(price, range.lower(), range.upper(), volatility, horizon);

            log.info("Position planned. poolId={} mode={} recommended={} widthPct={} probOut={}",
                     poolId, chosen, recommended,
                     StatMath.round(range.widthPct(), 4), StatMath.round(range.probOutOfRange(), 3));
            return new PositionPlan(poolId, chosen, recommended, price, volatility, horizon, capital,
                range, fees, ilRisk);
        });
    }
}
