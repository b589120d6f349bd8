package com.poolintelligence.common.tracker;

import com.poolintelligence.common.stats.StatMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolling 24h TVL history per pool, used to detect liquidity flight.
 *
 * <h3>Write path</h3>
 * <pre>
 *   tvl ≤ 0                         → ignored
 *   last entry younger than 60s     → overwrite its value in place
 *   otherwise                       → append
 *   last eviction older than 30 min → evictStale()
 * </pre>
 *
 * <h3>Drop penalty</h3>
 * <pre>
 *   drop = (peak24h − current) / peak24h × 100   when current &lt; peak, else 0
 *   ≥ 50 → 20,  ≥ 30 → 15,  ≥ 20 → 10,  ≥ 10 → 5,  else 0
 * </pre>
 *
 * <p>Single writer per pool is expected (the collection pass). Reads copy the series under
 * its lock, so concurrent scoring never iterates a list that is being appended to.
 * Constructed once at startup and shared; tests build a fresh instance per case.
 */
public class TvlPeakTracker {

    private static final Logger log = LoggerFactory.getLogger(TvlPeakTracker.class);

    public static final Duration WINDOW            = Duration.ofHours(24);
    public static final Duration EVICT_AFTER       = Duration.ofHours(25);
    public static final Duration DEBOUNCE          = Duration.ofSeconds(60);
    public static final Duration EVICTION_INTERVAL = Duration.ofMinutes(30);
    public static final int DEFAULT_MAX_POOLS      = 600;

    private final Clock clock;
    private final int maxPools;
    private final ConcurrentHashMap<String, Series> snapshots = new ConcurrentHashMap<>();
    private volatile long lastEvictionMillis;

    public TvlPeakTracker(Clock clock, int maxPools) {
        if (maxPools <= 0) {
            throw new IllegalArgumentException("maxPools must be positive, got " + maxPools);
        }
        this.clock = clock;
        this.maxPools = maxPools;
        this.lastEvictionMillis = clock.millis();
    }

    public TvlPeakTracker(Clock clock) {
        this(clock, DEFAULT_MAX_POOLS);
    }

    public void recordTvl(String poolId, double tvl) {
        if (!(tvl > 0) || poolId == null) return;
        long now = clock.millis();

        snapshots.compute(poolId, (id, series) -> {
            Series s = series != null ? series : new Series();
            s.record(now, tvl);
            return s;
        });

        if (now - lastEvictionMillis > EVICTION_INTERVAL.toMillis()) {
            evictStale();
        }
    }

    /** @param tvlByPool TVL keyed by pool id */
    public void recordBatchTvl(Map<String, Double> tvlByPool) {
        if (tvlByPool == null) return;
        tvlByPool.forEach((poolId, tvl) -> {
            if (tvl != null) recordTvl(poolId, tvl);
        });
    }

    /**
     * @param currentTvl the caller's current reading; {@code null} uses the latest recorded value
     */
    public TvlDropResult getTvlDrop(String poolId, Double currentTvl) {
        Series series = poolId != null ? snapshots.get(poolId) : null;
        List<Entry> entries = series != null ? series.copy() : List.of();

        if (entries.isEmpty()) {
            return TvlDropResult.noHistory(currentTvl != null ? currentTvl : 0.0);
        }

        long cutoff = clock.millis() - WINDOW.toMillis();
        List<Entry> window = new ArrayList<>();
        for (Entry e : entries) {
            if (e.timestamp >= cutoff) window.add(e);
        }
        if (window.isEmpty()) {
            double tvl = StatMath.isPositive(currentTvl) ? currentTvl : entries.get(entries.size() - 1).tvl;
            return TvlDropResult.noHistory(tvl);
        }

        double tvlNow = currentTvl != null ? currentTvl : window.get(window.size() - 1).tvl;
        double peak = 0;
        for (Entry e : window) peak = Math.max(peak, e.tvl);

        double dropPercent = 0;
        if (peak > 0 && tvlNow < peak) {
            dropPercent = ((peak - tvlNow) / peak) * 100;
        }

        return new TvlDropResult(
            tvlNow,
            Math.round(peak),
            StatMath.round(dropPercent, 1),
            window.size(),
            dropToPenalty(dropPercent));
    }

    /** @return results keyed by pool id, in input order */
    public Map<String, TvlDropResult> getBatchTvlDrop(Map<String, Double> tvlByPool) {
        Map<String, TvlDropResult> results = new LinkedHashMap<>();
        if (tvlByPool == null) return results;
        tvlByPool.forEach((poolId, tvl) -> results.put(poolId, getTvlDrop(poolId, tvl)));
        return results;
    }

    public static int dropToPenalty(double dropPercent) {
        if (dropPercent >= 50) return 20;
        if (dropPercent >= 30) return 15;
        if (dropPercent >= 20) return 10;
        if (dropPercent >= 10) return 5;
        return 0;
    }

    /**
     * Drops snapshots older than 25h, then the least-recently-written pools above the cap.
     *
     * @return number of removed snapshots plus removed pools
     */
    public int evictStale() {
        long now = clock.millis();
        long cutoff = now - EVICT_AFTER.toMillis();
        AtomicInteger evicted = new AtomicInteger();

        for (String poolId : snapshots.keySet()) {
            snapshots.computeIfPresent(poolId, (id, series) -> {
                int removed = series.removeOlderThan(cutoff);
                if (series.isEmpty()) {
                    evicted.incrementAndGet();
                    return null;
                }
                evicted.addAndGet(removed);
                return series;
            });
        }

        int overflow = snapshots.size() - maxPools;
        if (overflow > 0) {
            List<Map.Entry<String, Long>> byLastWrite = new ArrayList<>();
            snapshots.forEach((id, series) -> byLastWrite.add(Map.entry(id, series.lastWrite())));
            byLastWrite.sort(Comparator.comparingLong(Map.Entry::getValue));
            for (int i = 0; i < overflow && i < byLastWrite.size(); i++) {
                Map.Entry<String, Long> candidate = byLastWrite.get(i);
                if (evictIfUnchanged(candidate.getKey(), candidate.getValue())) {
                    evicted.incrementAndGet();
                }
            }
        }

        lastEvictionMillis = now;
        if (evicted.get() > 0) {
            log.info("TVL_EVICTION removed={} trackedPools={} maxPools={}", evicted.get(), snapshots.size(), maxPools);
        }
        return evicted.get();
    }

    /**
     * Removes the pool only if its last write is still {@code seenLastWrite}. A series written
     * to after the over-cap sort is no longer the least recent and stays.
     */
    boolean evictIfUnchanged(String poolId, long seenLastWrite) {
        boolean[] removed = {false};
        snapshots.computeIfPresent(poolId, (id, series) -> {
            if (series.lastWrite() != seenLastWrite) return series;
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    /** Timestamp of the pool's newest entry, 0 when untracked. */
    long lastWrite(String poolId) {
        Series series = snapshots.get(poolId);
        return series != null ? series.lastWrite() : 0L;
    }

    public TvlTrackerStats getStats() {
        long now = clock.millis();
        long oldest = now;
        int total = 0;
        for (Series series : snapshots.values()) {
            List<Entry> entries = series.copy();
            total += entries.size();
            if (!entries.isEmpty() && entries.get(0).timestamp < oldest) {
                oldest = entries.get(0).timestamp;
            }
        }
        return new TvlTrackerStats(snapshots.size(), total, Math.round((now - oldest) / 60_000.0));
    }

    public void clear() {
        snapshots.clear();
    }

    // ── Per-pool series ─────────────────────────────────────────────────────────

    private static final class Entry {
        private final long timestamp;
        private double tvl;

        private Entry(long timestamp, double tvl) {
            this.timestamp = timestamp;
            this.tvl = tvl;
        }
    }

    /** Oldest-first snapshot list guarded by its own monitor. */
    private static final class Series {
        private final List<Entry> entries = new ArrayList<>();

        synchronized void record(long now, double tvl) {
            if (!entries.isEmpty()) {
                Entry last = entries.get(entries.size() - 1);
                if (now - last.timestamp < DEBOUNCE.toMillis()) {
                    last.tvl = tvl;
                    return;
                }
            }
            entries.add(new Entry(now, tvl));
        }

        synchronized List<Entry> copy() {
            List<Entry> copy = new ArrayList<>(entries.size());
            for (Entry e : entries) copy.add(new Entry(e.timestamp, e.tvl));
            return copy;
        }

        synchronized int removeOlderThan(long cutoff) {
            int before = entries.size();
            entries.removeIf(e -> e.timestamp < cutoff);
            return before - entries.size();
        }

        synchronized boolean isEmpty() {
            return entries.isEmpty();
        }

        synchronized long lastWrite() {
            return entries.isEmpty() ? 0L : entries.get(entries.size() - 1).timestamp;
        }
    }
}
