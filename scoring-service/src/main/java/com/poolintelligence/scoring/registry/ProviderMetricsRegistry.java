package com.poolintelligence.scoring.registry;

import com.poolintelligence.common.consensus.SourceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider TVL/volume readings pushed by the collector, keyed by source then by
 * lower-case pool address. Feeds consensus detection.
 */
@Component
public class ProviderMetricsRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderMetricsRegistry.class);

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, SourceMetrics>> bySource =
        new ConcurrentHashMap<>();

    /** @return number of readings stored */
    public int putAll(String source, List<SourceMetrics> metrics) {
        ConcurrentHashMap<String, SourceMetrics> readings =
            bySource.computeIfAbsent(source, s -> new ConcurrentHashMap<>());
        int stored = 0;
        for (SourceMetrics m : metrics) {
            if (m == null || m.poolAddress() == null) continue;
            readings.put(m.poolAddress().toLowerCase(Locale.ROOT),
                new SourceMetrics(source, m.poolAddress(), m.tvl(), m.volume24h()));
            stored++;
        }
        log.info("PROVIDER_METRICS source={} stored={} total={}", source, stored, readings.size());
        return stored;
    }

    /** Readings of one source keyed by lower-case address; empty when the source is unknown. */
    public Map<String, SourceMetrics> forSource(String source) {
        if (source == null) return Map.of();
        ConcurrentHashMap<String, SourceMetrics> readings = bySource.get(source);
        return readings != null ? Map.copyOf(readings) : Map.of();
    }

    /** Readings for one pool from every source except {@code excludeSource}, in source-name order. */
    public List<SourceMetrics> forPool(String poolAddress, String excludeSource) {
        List<SourceMetrics> result = new ArrayList<>();
        if (poolAddress == null) return result;
        String key = poolAddress.toLowerCase(Locale.ROOT);
        bySource.keySet().stream().sorted().forEach(source -> {
            if (source.equals(excludeSource)) return;
            SourceMetrics m = bySource.get(source).get(key);
            if (m != null) result.add(m);
        });
        return result;
    }
}
