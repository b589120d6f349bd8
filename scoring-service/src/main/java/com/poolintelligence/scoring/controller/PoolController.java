package com.poolintelligence.scoring.controller;

import com.poolintelligence.common.consensus.ConsensusResult;
import com.poolintelligence.common.consensus.SourceMetrics;
import com.poolintelligence.common.exception.PoolIntelligenceException;
import com.poolintelligence.common.model.PoolType;
import com.poolintelligence.common.model.RiskMode;
import com.poolintelligence.common.tracker.TvlPeakTracker;
import com.poolintelligence.common.tracker.TvlTrackerStats;
import com.poolintelligence.scoring.dto.IngestResponse;
import com.poolintelligence.scoring.dto.SnapshotIngestRequest;
import com.poolintelligence.scoring.exception.UnknownPoolException;
import com.poolintelligence.scoring.registry.PoolSnapshotRegistry;
import com.poolintelligence.scoring.registry.ProviderMetricsRegistry;
import com.poolintelligence.scoring.registry.RegisteredPool;
import com.poolintelligence.scoring.service.ConsensusService;
import com.poolintelligence.scoring.service.PoolAssessment;
import com.poolintelligence.scoring.service.PoolFilter;
import com.poolintelligence.scoring.service.PoolRecommendation;
import com.poolintelligence.scoring.service.PoolScoringService;
import com.poolintelligence.scoring.service.PoolSortKey;
import com.poolintelligence.scoring.service.PositionPlan;
import com.poolintelligence.scoring.service.PositionPlanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pools")
public class PoolController {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);

    private final PoolScoringService scoringService;
    private final PositionPlanningService planningService;
    private final ConsensusService consensusService;
    private final PoolSnapshotRegistry snapshotRegistry;
    private final ProviderMetricsRegistry metricsRegistry;
    private final TvlPeakTracker tracker;

    public PoolController(PoolScoringService scoringService,
                          PositionPlanningService planningService,
                          ConsensusService consensusService,
                          PoolSnapshotRegistry snapshotRegistry,
                          ProviderMetricsRegistry metricsRegistry,
                          TvlPeakTracker tracker) {
        this.scoringService = scoringService;
        this.planningService = planningService;
        this.consensusService = consensusService;
        this.snapshotRegistry = snapshotRegistry;
        this.metricsRegistry = metricsRegistry;
        this.tracker = tracker;
    }

    @PostMapping("/snapshots")
    public Mono<ResponseEntity<IngestResponse>> ingest(@RequestBody SnapshotIngestRequest request) {
        return Mono.fromCallable(() -> scoringService.ingest(request))
            .map(RegisteredPool::poolId)
            .map(poolId -> ResponseEntity.ok(new IngestResponse(poolId, snapshotRegistry.size())));
    }

    @PostMapping("/sources/{source}/metrics")
    public Mono<ResponseEntity<Map<String, Object>>> providerMetrics(@PathVariable String source,
                                                                     @RequestBody List<SourceMetrics> metrics) {
        return Mono.fromCallable(() -> metricsRegistry.putAll(source, metrics))
            .map(stored -> ResponseEntity.ok(Map.<String, Object>of("source", source, "stored", stored)));
    }

    @GetMapping("/{poolId}/assessment")
    public Mono<ResponseEntity<PoolAssessment>> assessment(@PathVariable String poolId) {
        log.info("Assessment requested. poolId={}", poolId);
        return scoringService.assess(poolId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{poolId}/plan")
    public Mono<ResponseEntity<PositionPlan>> plan(@PathVariable String poolId,
                                                   @RequestParam(required = false) RiskMode mode,
                                                   @RequestParam(required = false) Double horizonDays,
                                                   @RequestParam(required = false) Double capital) {
        log.info("Position plan requested. poolId={} mode={} horizonDays={} capital={}",
                 poolId, mode, horizonDays, capital);
        return planningService.plan(poolId, mode, horizonDays, capital)
            .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<PoolAssessment>>> list(@RequestParam(required = false) String chain,
                                                           @RequestParam(required = false) String protocol,
                                                           @RequestParam(required = false) String token,
                                                           @RequestParam(required = false) Boolean bluechip,
                                                           @RequestParam(required = false) Double minTvl,
                                                           @RequestParam(required = false) Integer minHealth,
                                                           @RequestParam(required = false) PoolType poolType,
                                                           @RequestParam(defaultValue = "tvl") String sort,
                                                           @RequestParam(defaultValue = "desc") String direction) {
        PoolFilter filter = new PoolFilter(chain, protocol, token, bluechip, minTvl, minHealth, poolType);
        return scoringService.listPools(filter, PoolSortKey.fromKey(sort), !"asc".equalsIgnoreCase(direction))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/top")
    public Mono<ResponseEntity<List<PoolRecommendation>>> top(@RequestParam(defaultValue = "3") int limit,
                                                              @RequestParam(required = false) Double capital) {
        return scoringService.topRecommendations(limit, capital)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/consensus")
    public Mono<ResponseEntity<Map<String, ConsensusResult>>> consensus(
            @RequestParam String chain,
            @RequestParam(required = false) String secondary) {
        return consensusService.batchConsensus(chain, secondary)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/tracker/stats")
    public ResponseEntity<TvlTrackerStats> trackerStats() {
        return ResponseEntity.ok(tracker.getStats());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── error mapping ───────────────────────────────────────────────────────────

    @ExceptionHandler(UnknownPoolException.class)
    public ResponseEntity<Map<String, String>> unknownPool(UnknownPoolException e) {
        log.warn("Unknown pool requested. poolId={}", e.getPoolId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request. error={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(PoolIntelligenceException.class)
    public ResponseEntity<Map<String, String>> unprocessable(PoolIntelligenceException e) {
        log.warn("Request could not be completed. component={} error={}", e.getComponent(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
    }
}
