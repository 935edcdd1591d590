package in.opsboard.realtime;

import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.infrastructure.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Short-TTL cache of per-tenant metrics snapshots.
 *
 * - A snapshot younger than the TTL is returned as-is (same instance).
 * - Concurrent misses for one tenant share a single recomputation.
 * - Aggregation failures degrade to the last good snapshot, or {@link MetricsSnapshot#empty}.
 *   {@link #get} never throws.
 * - {@link #evictExpired} drops expired entries, and forgets a tenant entirely once its last good
 *   snapshot is older than the stale retention.
 */
public final class MetricsCache {
    private static final Logger log = LoggerFactory.getLogger(MetricsCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STALE_RETENTION = Duration.ofMinutes(5);

    private final SnapshotAggregator aggregator;
    private final Duration ttl;
    private final Duration staleRetention;
    private final Clock clock;
    private final RealtimeMetrics metrics;

    private final ConcurrentMap<String, CachedSnapshot> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CachedSnapshot> lastGood = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<MetricsSnapshot>> inFlight = new ConcurrentHashMap<>();
    // Set by invalidate() from a process-wide sequence; a computation started under an older value is
    // not cached. An absent tenant reads as 0.
    private final ConcurrentMap<String, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong generationSequence = new AtomicLong();

    public MetricsCache(SnapshotAggregator aggregator, Duration ttl, Duration staleRetention,
                        Clock clock, RealtimeMetrics metrics) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (staleRetention.compareTo(ttl) < 0) {
            throw new IllegalArgumentException("stale retention " + staleRetention + " is shorter than ttl " + ttl);
        }
        this.aggregator = aggregator;
        this.ttl = ttl;
        this.staleRetention = staleRetention;
        this.clock = clock;
        this.metrics = metrics;
    }

    public MetricsCache(SnapshotAggregator aggregator, Duration ttl, Clock clock, RealtimeMetrics metrics) {
        this(aggregator, ttl, ttl.compareTo(DEFAULT_STALE_RETENTION) > 0 ? ttl : DEFAULT_STALE_RETENTION,
            clock, metrics);
    }

    public MetricsCache(SnapshotAggregator aggregator) {
        this(aggregator, DEFAULT_TTL, Clock.systemUTC(), RealtimeMetrics.noop());
    }

    /**
     * Snapshot for a tenant, at most {@code ttl} old.
     */
    public MetricsSnapshot get(String tenantId) {
        CachedSnapshot cached = entries.get(tenantId);
        if (cached != null && cached.isFresh(clock.instant(), ttl)) {
            metrics.recordCacheHit();
            return cached.snapshot();
        }
        metrics.recordCacheMiss();

        CompletableFuture<MetricsSnapshot> mine = new CompletableFuture<>();
        CompletableFuture<MetricsSnapshot> leader = inFlight.putIfAbsent(tenantId, mine);
        if (leader != null) {
            log.debug("[CACHE] {} joining in-flight computation", tenantId);
            return leader.join();
        }

        try {
            // Another leader may have stored a result between our miss and winning the slot.
            CachedSnapshot again = entries.get(tenantId);
            if (again != null && again.isFresh(clock.instant(), ttl)) {
                mine.complete(again.snapshot());
                return again.snapshot();
            }
            MetricsSnapshot result = compute(tenantId);
            mine.complete(result);
            return result;
        } finally {
            if (!mine.isDone()) {
                mine.complete(fallback(tenantId));
            }
            inFlight.remove(tenantId, mine);
        }
    }

    /**
     * Drop the cached entry so the next {@link #get} recomputes. The last good snapshot is kept as
     * the failure fallback.
     */
    public void invalidate(String tenantId) {
        generations.compute(tenantId, (k, current) -> {
            if (entries.remove(k) != null) {
                log.debug("[CACHE] {} invalidated", k);
            }
            return generationSequence.incrementAndGet();
        });
    }

    /**
     * Drop entries older than the TTL. A tenant whose last good snapshot is older than the stale
     * retention, and which has nothing in flight, is forgotten together with its generation.
     *
     * @return number of tenants forgotten
     */
    public int evictExpired() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> !e.getValue().isFresh(now, ttl));

        int forgotten = 0;
        for (String tenantId : lastGood.keySet()) {
            boolean[] removed = {false};
            generations.compute(tenantId, (k, generation) -> {
                CachedSnapshot previous = lastGood.get(k);
                if (previous == null || previous.isFresh(now, staleRetention) || inFlight.containsKey(k)) {
                    return generation;
                }
                lastGood.remove(k);
                entries.remove(k);
                removed[0] = true;
                return null;
            });
            if (removed[0]) {
                forgotten++;
            }
        }
        // Invalidated tenants that never produced a snapshot.
        for (String tenantId : generations.keySet()) {
            generations.computeIfPresent(tenantId, (k, generation) ->
                lastGood.containsKey(k) || entries.containsKey(k) || inFlight.containsKey(k) ? generation : null);
        }

        if (forgotten > 0) {
            log.debug("[CACHE] forgot {} idle tenant(s), {} cached, {} retained", forgotten, entries.size(), lastGood.size());
        }
        return forgotten;
    }

    public int size() {
        return entries.size();
    }

    int trackedTenants() {
        Set<String> tenants = new HashSet<>(entries.keySet());
        tenants.addAll(lastGood.keySet());
        tenants.addAll(generations.keySet());
        return tenants.size();
    }

    private MetricsSnapshot compute(String tenantId) {
        long startGeneration = generations.getOrDefault(tenantId, 0L);
        try {
            MetricsSnapshot snapshot = aggregator.computeSnapshot(tenantId);
            if (snapshot == null) {
                throw new AggregationException(tenantId, "aggregator returned no snapshot");
            }
            CachedSnapshot stored = new CachedSnapshot(snapshot, clock.instant());
            // Compare and store under the generation's bin lock so invalidate() cannot slip between them.
            generations.compute(tenantId, (k, current) -> {
                lastGood.put(k, stored);
                if ((current == null ? 0L : current) == startGeneration) {
                    entries.put(k, stored);
                } else {
                    log.debug("[CACHE] {} invalidated during aggregation, not caching", k);
                }
                return current;
            });
            return snapshot;
        } catch (RuntimeException e) {
            MetricsSnapshot previous = lastGoodSnapshot(tenantId);
            metrics.recordAggregationFailure(previous != null);
            log.warn("[CACHE] aggregation failed for {} (serving {}): {}",
                tenantId, previous != null ? "stale snapshot" : "empty snapshot", e.getMessage());
            return previous != null ? previous : MetricsSnapshot.empty(tenantId);
        }
    }

    private MetricsSnapshot fallback(String tenantId) {
        MetricsSnapshot previous = lastGoodSnapshot(tenantId);
        return previous != null ? previous : MetricsSnapshot.empty(tenantId);
    }

    private MetricsSnapshot lastGoodSnapshot(String tenantId) {
        CachedSnapshot previous = lastGood.get(tenantId);
        return previous != null ? previous.snapshot() : null;
    }

    private record CachedSnapshot(MetricsSnapshot snapshot, Instant storedAt) {
        boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }
}
