package com.poolintelligence.scoring.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of the latest snapshot per pool, written by the collector.
 *
 * <p>One writer per pool id is expected; a new registration replaces the previous one
 * atomically, so scoring always reads a complete entry.
 */
@Component
public class PoolSnapshotRegistry {

    private static final Logger log = LoggerFactory.getLogger(PoolSnapshotRegistry.class);

    private final ConcurrentHashMap<String, RegisteredPool> store = new ConcurrentHashMap<>();

    public void register(RegisteredPool pool) {
        RegisteredPool previous = store.put(pool.poolId(), pool);
        log.debug("SNAPSHOT_REGISTERED poolId={} source={} replaced={}",
                  pool.poolId(), pool.source(), previous != null);
    }

    public Optional<RegisteredPool> get(String poolId) {
        return Optional.ofNullable(store.get(poolId));
    }

    public List<RegisteredPool> all() {
        return new ArrayList<>(store.values());
    }

    public List<RegisteredPool> byChain(String chainId) {
        List<RegisteredPool> result = new ArrayList<>();
        for (RegisteredPool p : store.values()) {
            if (p.snapshot().chainId() != null && p.snapshot().chainId().equalsIgnoreCase(chainId)) {
                result.add(p);
            }
        }
        return result;
    }

    public int size() {
        return store.size();
    }
}
