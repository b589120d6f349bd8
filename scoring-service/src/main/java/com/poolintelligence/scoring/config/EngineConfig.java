package com.poolintelligence.scoring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.range.RangeModel;
import com.poolintelligence.common.range.RiskModeTable;
import com.poolintelligence.common.score.ScoreComposer;
import com.poolintelligence.common.score.ScoreWeights;
import com.poolintelligence.common.score.ScoringThresholds;
import com.poolintelligence.common.tracker.TvlPeakTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the engine with values from {@code application.yml} ({@code scoring.*}).
 * Every value has a default so the service starts with no configuration at all.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${scoring.weights.health:40}")
    private double healthWeight;

    @Value("${scoring.weights.return:35}")
    private double returnWeight;

    @Value("${scoring.weights.risk:25}")
    private double riskWeight;

    @Value("${scoring.thresholds.min-liquidity:100000}")
    private double minLiquidity;

    @Value("${scoring.thresholds.min-volume-24h:10000}")
    private double minVolume24h;

    @Value("${scoring.thresholds.aggressive-volatility-max:30}")
    private double aggressiveVolatilityMax;

    @Value("${scoring.thresholds.normal-volatility-max:15}")
    private double normalVolatilityMax;

    @Value("${scoring.thresholds.unknown-volatility-score-gate:75}")
    private double unknownVolatilityScoreGate;

    @Value("${scoring.range.z-score.defensive:0.8}")
    private double zDefensive;

    @Value("${scoring.range.z-score.normal:1.2}")
    private double zNormal;

    @Value("${scoring.range.z-score.aggressive:1.8}")
    private double zAggressive;

    @Value("${scoring.range.active-fraction.defensive:0.55}")
    private double activeDefensive;

    @Value("${scoring.range.active-fraction.normal:0.75}")
    private double activeNormal;

    @Value("${scoring.range.active-fraction.aggressive:0.95}")
    private double activeAggressive;

    @Value("${scoring.range.stable-width-cap:0.03}")
    private double stableWidthCap;

    @Value("${scoring.tracker.max-pools:600}")
    private int trackerMaxPools;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ScoreWeights scoreWeights() {
        return new ScoreWeights(healthWeight, returnWeight, riskWeight);
    }

    @Bean
    public ScoringThresholds scoringThresholds() {
        return new ScoringThresholds(minLiquidity, minVolume24h,
            aggressiveVolatilityMax, normalVolatilityMax, unknownVolatilityScoreGate);
    }

    @Bean
    public ScoreComposer scoreComposer(ScoreWeights weights, ScoringThresholds thresholds) {
        log.info("Score composer configured. weights={} thresholds={}", weights, thresholds);
        return new ScoreComposer(weights, thresholds);
    }

    @Bean
    public RiskModeTable riskModeTable() {
        return new RiskModeTable(
            Map.of(RiskMode.DEFENSIVE, zDefensive, RiskMode.NORMAL, zNormal, RiskMode.AGGRESSIVE, zAggressive),
            Map.of(RiskMode.DEFENSIVE, activeDefensive, RiskMode.NORMAL, activeNormal, RiskMode.AGGRESSIVE, activeAggressive),
            stableWidthCap);
    }

    @Bean
    public RangeModel rangeModel(RiskModeTable riskModeTable) {
        return new RangeModel(riskModeTable);
    }

    @Bean
    public TvlPeakTracker tvlPeakTracker(Clock clock) {
        return new TvlPeakTracker(clock, trackerMaxPools);
    }
}
