package com.poolintelligence.scoring.service;

import com.poolintelligence.common.enrich.EnrichedPool;
import com.poolintelligence.common.enrich.PoolEnricher;
import com.poolintelligence.common.enrich.VolatilityOrigin;
import com.poolintelligence.common.execution.ExecutionCostEstimator;
import com.poolintelligence.common.execution.ExecutionCostResult;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.recommend.GainEstimate;
import com.poolintelligence.common.recommend.RecommendationRules;
import com.poolintelligence.common.score.Score;
import com.poolintelligence.common.score.ScoreComposer;
import com.poolintelligence.common.score.ScoreInput;
import com.poolintelligence.common.tracker.TvlDropResult;
import com.poolintelligence.common.tracker.TvlPeakTracker;
import com.poolintelligence.common.yield.SamplingInterval;
import com.poolintelligence.common.yield.VolatilityEstimate;
import com.poolintelligence.common.yield.VolatilityEstimator;
import com.poolintelligence.scoring.dto.SnapshotIngestRequest;
import com.poolintelligence.scoring.exception.UnknownPoolException;
import com.poolintelligence.scoring.registry.PoolSnapshotRegistry;
import com.poolintelligence.scoring.registry.RegisteredPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Snapshot → score pipeline.
 *
 * <pre>
 *   ingest:  register snapshot, record TVL in the peak tracker
 *   assess:  volatility → enrichment → consensus → execution cost → TVL drop → compose
 * </pre>
 *
 * The snapshot is always recorded before the pass that reads it; stale-but-present data is
 * scored as is.
 */
@Service
public class PoolScoringService {

    private static final Logger log = LoggerFactory.getLogger(PoolScoringService.class);

    static final String HONEYPOT = "honeypot";
    static final Duration RECOMMENDATION_VALIDITY = Duration.ofHours(24);

    private final PoolSnapshotRegistry registry;
    private final TvlPeakTracker tracker;
    private final ConsensusService consensusService;
    private final ScoreComposer composer;
    private final Clock clock;
    private final String primarySource;
    private final double defaultCapitalUsd;

    public PoolScoringService(PoolSnapshotRegistry registry,
                              TvlPeakTracker tracker,
                              ConsensusService consensusService,
                              ScoreComposer composer,
                              Clock clock,
                              @Value("${scoring.consensus.primary-source:dexscreener}") String primarySource,
                              @Value("${scoring.planning.default-capital-usd:1000}") double defaultCapitalUsd) {
        this.registry = registry;
        this.tracker = tracker;
        this.consensusService = consensusService;
        this.composer = composer;
        this.clock = clock;
        this.primarySource = primarySource;
        this.defaultCapitalUsd = defaultCapitalUsd;
    }

    public RegisteredPool ingest(SnapshotIngestRequest request) {
        PoolSnapshot snapshot = request != null ? request.snapshot() : null;
        if (snapshot == null || snapshot.chainId() == null || snapshot.poolAddress() == null) {
            throw new IllegalArgumentException("snapshot with chainId and poolAddress is required");
        }
        RegisteredPool pool = new RegisteredPool(
            snapshot,
            request.priceHistory() != null ? List.copyOf(request.priceHistory()) : List.of(),
            request.interval() != null ? request.interval() : SamplingInterval.HOURLY,
            request.warnings() != null ? List.copyOf(request.warnings()) : List.of(),
            request.source() != null && !request.source().isBlank() ? request.source() : primarySource,
            clock.instant());

        registry.register(pool);
        tracker.recordTvl(pool.poolId(), snapshot.tvl());
        log.info("Snapshot ingested. poolId={} pair={} tvl={} historyPoints={}",
                 pool.poolId(), snapshot.pairLabel(), snapshot.tvl(), pool.priceHistory().size());
        return pool;
    }

    public Mono<PoolAssessment> assess(String poolId) {
        return Mono.justOrEmpty(registry.get(poolId))
            .switchIfEmpty(Mono.error(new UnknownPoolException(poolId)))
            .flatMap(this::assess);
    }

    Mono<PoolAssessment> assess(RegisteredPool pool) {
        PoolSnapshot snapshot = pool.snapshot();
        Instant now = clock.instant();

        VolatilityEstimate measured = VolatilityEstimator.calcVolatilityAnn(pool.priceHistory(), pool.interval());
        EnrichedPool enriched = PoolEnricher.enrich(snapshot, measured, pool.warnings(), now);
        if (enriched.volatilityOrigin() == VolatilityOrigin.DEFAULT) {
            log.info("VOLATILITY_FALLBACK poolId={} historyPoints={} assumed={}",
                     pool.poolId(), measured.dataPoints(), enriched.volatilityAnn());
        }

        return consensusService.consensusFor(pool).map(consensus -> {
            ExecutionCostResult executionCost = ExecutionCostEstimator.calculate(
                snapshot.tvl(), snapshot.volume24hOrZero(), enriched.poolType());
            TvlDropResult tvlDrop = tracker.getTvlDrop(pool.poolId(), snapshot.tvl());

            Score score = composer.compose(new ScoreInput(
                snapshot,
                enriched.poolType(),
                enriched.bluechip(),
                enriched.scoringVolatility(),
                enriched.aprTotal(),
                tvlDrop.liquidityDropPenalty(),
                consensus.inconsistencyPenalty(),
                executionCost.executionCostPenalty()));

            if (score.suspect()) {
                log.info("SCORE_SUSPECT poolId={} total={} reasons=\"{}\"",
                         pool.poolId(), score.total(), String.join("; ", score.suspectReasons()));
            }
            log.debug("Pool scored. poolId={} total={} mode={} health={} return={} risk={}",
                      pool.poolId(), score.total(), score.recommendedMode(),
                      score.health(), score.ret(), score.risk());

            return new PoolAssessment(pool.poolId(), enriched, measured, consensus, executionCost, tvlDrop, score);
        });
    }

    public Mono<List<PoolAssessment>> assessAll() {
        List<RegisteredPool> pools = registry.all();
        log.info("Scoring {} registered pools", pools.size());
        return Flux.fromIterable(pools)
            .flatMap(this::assess)
            .collectList();
    }

    /**
     * Assessed pools matching {@code filter}, ordered by {@code sortKey}. Ties keep pool id order.
     */
    public Mono<List<PoolAssessment>> listPools(PoolFilter filter, PoolSortKey sortKey, boolean descending) {
        PoolFilter criteria = filter != null ? filter : PoolFilter.none();
        PoolSortKey key = sortKey != null ? sortKey : PoolSortKey.TVL;
        Comparator<PoolAssessment> byKey = Comparator.comparingDouble(key::extract);
        Comparator<PoolAssessment> order = (descending ? byKey.reversed() : byKey)
            .thenComparing(PoolAssessment::poolId);

        return assessAll().map(assessments -> {
            List<PoolAssessment> matching = new ArrayList<>();
            for (PoolAssessment a : assessments) {
                if (criteria.matches(a.pool())) matching.add(a);
            }
            matching.sort(order);
            log.debug("Pools listed. matching={} total={} sort={} descending={}",
                      matching.size(), assessments.size(), key.key(), descending);
            return matching;
        });
    }

    public Mono<List<PoolRecommendation>> topRecommendations(int limit) {
        return topRecommendations(limit, null);
    }

    /**
     * Highest total scores first, skipping pools with a honeypot warning or a suspect score.
     *
     * @param capitalUsd capital the gain estimate is computed on; {@code null} uses
     *                   {@code scoring.planning.default-capital-usd}
     */
    public Mono<List<PoolRecommendation>> topRecommendations(int limit, Double capitalUsd) {
        if (limit <= 0) {
            return Mono.just(List.of());
        }
        double capital = capitalUsd != null ? capitalUsd : defaultCapitalUsd;
        return assessAll().map(assessments -> {
            List<PoolAssessment> eligible = new ArrayList<>();
            for (PoolAssessment a : assessments) {
                if (a.pool().hasWarning(HONEYPOT)) continue;
                if (a.score().suspect()) {
                    log.debug("Suspect pool left out of ranking. poolId={} reasons=\"{}\"",
                              a.poolId(), String.join("; ", a.score().suspectReasons()));
                    continue;
                }
                eligible.add(a);
            }
            eligible.sort(Comparator.comparingDouble((PoolAssessment a) -> a.score().total()).reversed()
                .thenComparing(PoolAssessment::poolId));

            List<PoolRecommendation> top = new ArrayList<>();
            for (int i = 0; i < Math.min(limit, eligible.size()); i++) {
                top.add(recommend(i + 1, eligible.get(i), capital));
            }
            return top;
        });
    }

    private PoolRecommendation recommend(int rank, PoolAssessment a, double capitalUsd) {
        PoolSnapshot snapshot = a.pool().snapshot();
        Score score = a.score();
        RiskMode mode = score.recommendedMode();
        GainEstimate gains = RecommendationRules.estimateGains(snapshot, score, capitalUsd, mode);
        return new PoolRecommendation(
            rank,
            a.poolId(),
            snapshot.pairLabel(),
            score.total(),
            mode,
            reasonFor(a),
            RecommendationRules.probability(score, mode),
            gains.gainPercent(),
            gains.gainUsd(),
            capitalUsd,
            RecommendationRules.entryConditions(snapshot, mode),
            RecommendationRules.exitConditions(mode, composer.thresholds().minVolume24h()),
            RecommendationRules.mainRisks(snapshot, score),
            a.pool().evaluatedAt().plus(RECOMMENDATION_VALIDITY),
            a);
    }

    static String reasonFor(PoolAssessment a) {
        double total = a.score().total();
        if (total >= 70) {
            String apr = a.pool().aprTotal() != null
                ? String.format(Locale.ROOT, "%.1f%%", a.pool().aprTotal())
                : "N/A";
            return String.format(Locale.ROOT, "High score (%.1f/100) with TVL $%.2fM. Estimated APR %s.",
                total, a.pool().snapshot().tvl() / 1e6, apr);
        }
        if (total >= 50) {
            return String.format(Locale.ROOT, "Score %.1f/100. Balanced risk/return with %s.",
                total, a.pool().bluechip() ? "blue-chip tokens" : "adequate liquidity");
        }
        return String.format(Locale.ROOT,
            "Score %.1f/100. Conservative positioning recommended; monitor TVL and volume.", total);
    }
}
