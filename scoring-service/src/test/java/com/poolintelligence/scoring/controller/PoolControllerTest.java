package com.poolintelligence.scoring.controller;

import com.poolintelligence.common.consensus.SourceMetrics;
import com.poolintelligence.scoring.dto.SnapshotIngestRequest;
import com.poolintelligence.scoring.support.ScoringFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

class PoolControllerTest {

    private ScoringFixture fx;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fx = new ScoringFixture();
        PoolController controller = new PoolController(fx.scoringService, fx.planningService,
            fx.consensusService, fx.snapshotRegistry, fx.metricsRegistry, fx.tracker);
        client = WebTestClient.bindToController(controller).build();
    }

    // ── ingest ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST endpoints")
    class IngestTests {

        @Test
        @DisplayName("snapshot ingest returns the pool id and registry size")
        void ingest() {
            client.post().uri("/api/v1/pools/snapshots")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(fx.withHistory(fx.deepPool("0xDeep").build(), List.of()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.poolId").isEqualTo("ethereum_0xdeep")
                .jsonPath("$.registeredPools").isEqualTo(1);
        }

        @Test
        @DisplayName("missing snapshot → 400")
        void badSnapshot() {
            client.post().uri("/api/v1/pools/snapshots")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new SnapshotIngestRequest(null, null, null, null, null))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").exists();
        }

        @Test
        @DisplayName("provider metrics are stored under the path source")
        void metrics() {
            client.post().uri("/api/v1/pools/sources/geckoterminal/metrics")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(new SourceMetrics("ignored", "0xdeep", 9_800_000, 2_000_000)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.source").isEqualTo("geckoterminal")
                .jsonPath("$.stored").isEqualTo(1);
        }
    }

    // ── reads ───────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("GET endpoints")
    class ReadTests {

        @BeforeEach
        void ingest() {
            fx.scoringService.ingest(fx.withHistory(fx.deepPool("0xdeep").build(), List.of()));
        }

        @Test
        @DisplayName("assessment carries the composed score")
        void assessment() {
            client.get().uri("/api/v1/pools/ethereum_0xdeep/assessment")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.score.total").isEqualTo(59.9)
                .jsonPath("$.score.recommendedMode").isEqualTo("NORMAL")
                .jsonPath("$.executionCost.executionCostPenalty").isEqualTo(0);
        }

        @Test
        @DisplayName("unknown pool → 404")
        void unknownPool() {
            client.get().uri("/api/v1/pools/ethereum_0xnope/assessment")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").exists();
        }

        @Test
        @DisplayName("plan honours the mode parameter")
        void plan() {
            client.get().uri("/api/v1/pools/ethereum_0xdeep/plan?mode=DEFENSIVE&horizonDays=14&capital=5000")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.mode").isEqualTo("DEFENSIVE")
                .jsonPath("$.recommendedMode").isEqualTo("NORMAL")
                .jsonPath("$.horizonDays").isEqualTo(14.0)
                .jsonPath("$.range.lower").exists();
        }

        @Test
        @DisplayName("plan for a pool without a price → 422")
        void planWithoutPrice() {
            fx.scoringService.ingest(SnapshotIngestRequest.of(fx.deepPool("0xnoprice").price(null).build()));

            client.get().uri("/api/v1/pools/ethereum_0xnoprice/plan")
                .exchange()
                .expectStatus().isEqualTo(422);
        }

        @Test
        @DisplayName("top lists ranked recommendations")
        void top() {
            client.get().uri("/api/v1/pools/top?limit=3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].rank").isEqualTo(1)
                .jsonPath("$[0].poolId").isEqualTo("ethereum_0xdeep");
        }

        @Test
        @DisplayName("top carries probability and gains on the requested capital")
        void topWithCapital() {
            client.get().uri("/api/v1/pools/top?limit=1&capital=2000")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].probability").isEqualTo(42)
                .jsonPath("$[0].capitalUsd").isEqualTo(2000.0)
                .jsonPath("$[0].mainRisks.length()").isEqualTo(1)
                .jsonPath("$[0].exitConditions").isArray();
        }

        @Test
        @DisplayName("listing applies filters and sort")
        void list() {
            fx.scoringService.ingest(fx.withHistory(
                fx.deepPool("0xthin").tokens("PEPE", "WETH").tvl(200_000).volume24h(20_000.0).build(), List.of()));

            client.get().uri("/api/v1/pools?sort=tvl&direction=asc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].poolId").isEqualTo("ethereum_0xthin");

            client.get().uri("/api/v1/pools?bluechip=true&minTvl=1000000&poolType=CL")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].poolId").isEqualTo("ethereum_0xdeep");
        }

        @Test
        @DisplayName("batch consensus is keyed by pool address")
        void consensus() {
            fx.metricsRegistry.putAll(ScoringFixture.SECONDARY,
                List.of(new SourceMetrics(null, "0xdeep", 10_000_000, 2_000_000)));

            client.get().uri("/api/v1/pools/consensus?chain=ethereum")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$['0xdeep'].inconsistencyPenalty").isEqualTo(0);
        }

        @Test
        @DisplayName("tracker stats reflect ingested snapshots")
        void trackerStats() {
            client.get().uri("/api/v1/pools/tracker/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.trackedPools").isEqualTo(1)
                .jsonPath("$.totalSnapshots").isEqualTo(1);
        }

        @Test
        @DisplayName("health → OK")
        void health() {
            client.get().uri("/api/v1/pools/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }
    }
}
