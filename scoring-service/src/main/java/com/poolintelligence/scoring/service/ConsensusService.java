package com.poolintelligence.scoring.service;

import com.poolintelligence.common.consensus.ConsensusDetector;
import com.poolintelligence.common.consensus.ConsensusResult;
import com.poolintelligence.common.consensus.SourceMetrics;
import com.poolintelligence.common.model.PoolSnapshot;
import com.poolintelligence.scoring.registry.PoolSnapshotRegistry;
import com.poolintelligence.scoring.registry.ProviderMetricsRegistry;
import com.poolintelligence.scoring.registry.RegisteredPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs consensus detection over the provider readings held in memory.
 *
 * <p>Pools are compared in parallel on the bounded-elastic scheduler. Each comparison is
 * bounded by {@code scoring.consensus.timeout-ms}; a pool that times out or fails gets a
 * zero-penalty result so scoring can continue without corroboration.
 */
@Service
public class ConsensusService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusService.class);

    static final String UNAVAILABLE_REASON = "consensus unavailable";

    private final ProviderMetricsRegistry metricsRegistry;
    private final PoolSnapshotRegistry snapshotRegistry;
    private final String secondarySource;
    private final Duration timeout;

    public ConsensusService(ProviderMetricsRegistry metricsRegistry,
                            PoolSnapshotRegistry snapshotRegistry,
                            @Value("${scoring.consensus.secondary-source:geckoterminal}") String secondarySource,
                            @Value("${scoring.consensus.timeout-ms:2000}") long timeoutMs) {
        this.metricsRegistry = metricsRegistry;
        this.snapshotRegistry = snapshotRegistry;
        this.secondarySource = secondarySource;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /** Single-pool consensus across the snapshot's source and up to two other providers. */
    public Mono<ConsensusResult> consensusFor(RegisteredPool pool) {
        PoolSnapshot snapshot = pool.snapshot();
        return Mono.fromCallable(() -> {
                List<SourceMetrics> others = metricsRegistry.forPool(snapshot.poolAddress(), pool.source());
                return ConsensusDetector.compareSingle(snapshot.chainId(), pool.source(), snapshot, others);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnNext(this::logDivergence)
            .onErrorResume(e -> {
                log.warn("CONSENSUS_UNAVAILABLE poolId={} error={}", pool.poolId(), e.toString());
                return Mono.just(unavailable(snapshot));
            });
    }

    /**
     * Batch consensus for every registered pool on a chain against one secondary source.
     *
     * @param secondary provider to compare with; {@code null} uses the configured one
     * @return results keyed by lower-case pool address
     */
    public Mono<Map<String, ConsensusResult>> batchConsensus(String chainId, String secondary) {
        String against = secondary != null && !secondary.isBlank() ? secondary : secondarySource;
        Map<String, SourceMetrics> readings = metricsRegistry.forSource(against);
        List<RegisteredPool> pools = snapshotRegistry.byChain(chainId);
        log.info("Batch consensus started. chain={} pools={} secondary={} readings={}",
                 chainId, pools.size(), against, readings.size());

        return Flux.fromIterable(pools)
            .flatMap(pool -> Mono.fromCallable(() -> ConsensusDetector.compareBatch(
                        chainId, pool.source(), List.of(pool.snapshot()), against, readings))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("CONSENSUS_UNAVAILABLE poolId={} error={}", pool.poolId(), e.toString());
                    PoolSnapshot s = pool.snapshot();
                    return Mono.just(Map.of(s.poolAddress().toLowerCase(Locale.ROOT), unavailable(s)));
                }))
            .collectList()
            .map(partials -> {
                Map<String, ConsensusResult> merged = new LinkedHashMap<>();
                partials.forEach(merged::putAll);
                merged.values().forEach(this::logDivergence);
                return merged;
            });
    }

    private void logDivergence(ConsensusResult result) {
        if (result.inconsistencyPenalty() > 0) {
            log.info("CONSENSUS_DIVERGENCE pool={} chain={} maxDivergence={} penalty={} reason=\"{}\"",
                     result.poolAddress(), result.chain(),
                     String.format(Locale.ROOT, "%.1f", result.maxDivergence()),
                     result.inconsistencyPenalty(), result.reason());
        }
    }

    private static ConsensusResult unavailable(PoolSnapshot snapshot) {
        return ConsensusResult.withoutComparison(snapshot.poolAddress(), snapshot.chainId(),
            Map.of(), Map.of(), UNAVAILABLE_REASON);
    }
}
