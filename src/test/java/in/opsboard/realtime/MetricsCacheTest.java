package in.opsboard.realtime;

import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.infrastructure.metrics.RealtimeMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MetricsCache.
 *
 * Tests:
 * - Fresh hits return the same instance
 * - Expiry triggers exactly one recompute
 * - Failures fall back to the last good snapshot, then to the empty snapshot
 * - Invalidate forces a recompute
 * - Concurrent misses share one computation
 * - An invalidate during aggregation keeps the stale result out of the cache
 * - Eviction bounds per-tenant state
 */
@ExtendWith(MockitoExtension.class)
class MetricsCacheTest {

    private static final Duration TTL = Duration.ofSeconds(5);

    @Mock
    private SnapshotAggregator aggregator;

    private MutableClock clock;
    private MetricsCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        cache = new MetricsCache(aggregator, TTL, clock, RealtimeMetrics.noop());
    }

    private MetricsSnapshot snapshotAt(String tenant) {
        MetricsSnapshot empty = MetricsSnapshot.empty(tenant);
        return new MetricsSnapshot(tenant, empty.orders(), empty.revenue(), empty.tables(),
            empty.staff(), empty.inventory(), clock.instant());
    }

    @Test
    void testFreshEntryReturnsSameInstance() {
        when(aggregator.computeSnapshot("t1")).thenAnswer(inv -> snapshotAt("t1"));

        MetricsSnapshot first = cache.get("t1");
        clock.advance(Duration.ofSeconds(4));
        MetricsSnapshot second = cache.get("t1");

        assertSame(first, second);
        verify(aggregator, times(1)).computeSnapshot("t1");
    }

    @Test
    void testExpiredEntryRecomputesExactlyOnce() {
        when(aggregator.computeSnapshot("t1")).thenAnswer(inv -> snapshotAt("t1"));

        MetricsSnapshot first = cache.get("t1");
        clock.advance(TTL);
        MetricsSnapshot second = cache.get("t1");
        MetricsSnapshot third = cache.get("t1");

        assertNotSame(first, second);
        assertSame(second, third);
        verify(aggregator, times(2)).computeSnapshot("t1");
    }

    @Test
    void testFailureServesLastGoodSnapshot() {
        MetricsSnapshot good = snapshotAt("t1");
        when(aggregator.computeSnapshot("t1"))
            .thenReturn(good)
            .thenThrow(new AggregationException("t1", "db down"));

        assertSame(good, cache.get("t1"));
        clock.advance(TTL.plusSeconds(1));

        assertSame(good, cache.get("t1"), "Stale snapshot should be served on failure");
    }

    @Test
    void testFailureWithoutHistoryServesEmptySnapshot() {
        when(aggregator.computeSnapshot("t1")).thenThrow(new AggregationException("t1", "db down"));

        MetricsSnapshot result = cache.get("t1");

        assertTrue(result.isEmpty());
        assertEquals("t1", result.tenantId());
        assertEquals(0, result.orders().active());
    }

    @Test
    void testFailureIsNotCachedAndIsRecorded() {
        RealtimeMetrics metrics = mock(RealtimeMetrics.class);
        cache = new MetricsCache(aggregator, TTL, clock, metrics);
        when(aggregator.computeSnapshot("t1"))
            .thenThrow(new IllegalStateException("boom"))
            .thenAnswer(inv -> snapshotAt("t1"));

        assertTrue(cache.get("t1").isEmpty());
        assertFalse(cache.get("t1").isEmpty(), "A failure must not be cached");

        verify(metrics).recordAggregationFailure(false);
        verify(metrics, times(2)).recordCacheMiss();
    }

    @Test
    void testNullResultIsTreatedAsFailure() {
        when(aggregator.computeSnapshot("t1")).thenReturn(null);

        assertTrue(cache.get("t1").isEmpty());
    }

    @Test
    void testInvalidateForcesRecompute() {
        when(aggregator.computeSnapshot("t1")).thenAnswer(inv -> snapshotAt("t1"));

        MetricsSnapshot first = cache.get("t1");
        cache.invalidate("t1");
        MetricsSnapshot second = cache.get("t1");

        assertNotSame(first, second);
        verify(aggregator, times(2)).computeSnapshot("t1");
    }

    @Test
    void testTenantsAreCachedIndependently() {
        when(aggregator.computeSnapshot(anyString())).thenAnswer(inv -> snapshotAt(inv.getArgument(0)));

        assertEquals("t1", cache.get("t1").tenantId());
        assertEquals("t2", cache.get("t2").tenantId());
        cache.invalidate("t1");
        cache.get("t2");

        assertEquals(1, cache.size());
        verify(aggregator, times(1)).computeSnapshot("t2");
    }

    @Test
    void testNonPositiveTtlRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new MetricsCache(aggregator, Duration.ZERO, clock, RealtimeMetrics.noop()));
    }

    @Test
    void testConcurrentMissesShareOneComputation() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SnapshotAggregator slow = tenant -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return snapshotAt(tenant);
        };
        MetricsCache shared = new MetricsCache(slow, TTL, clock, RealtimeMetrics.noop());

        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<MetricsSnapshot>> results = new ArrayList<>();
        results.add(pool.submit(() -> shared.get("t1")));
        assertTrue(entered.await(5, TimeUnit.SECONDS), "Leader should start computing");
        for (int i = 0; i < 5; i++) {
            results.add(pool.submit(() -> shared.get("t1")));
        }
        // Give the followers time to reach the in-flight computation.
        Thread.sleep(200);
        release.countDown();

        MetricsSnapshot first = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<MetricsSnapshot> f : results) {
            assertSame(first, f.get(5, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertEquals(1, calls.get(), "Concurrent misses must trigger one aggregation");
    }

    @Test
    void testInvalidateDuringComputeIsNotOverwritten() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SnapshotAggregator latched = tenant -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return snapshotAt(tenant);
        };
        MetricsCache guarded = new MetricsCache(latched, TTL, clock, RealtimeMetrics.noop());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<MetricsSnapshot> inFlight = pool.submit(() -> guarded.get("t1"));
        assertTrue(entered.await(5, TimeUnit.SECONDS), "Aggregation should be running");

        guarded.invalidate("t1");
        release.countDown();
        MetricsSnapshot beforeInvalidate = inFlight.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        MetricsSnapshot next = guarded.get("t1");

        assertEquals(2, calls.get(), "Result computed before invalidate must not be cached");
        assertNotSame(beforeInvalidate, next);
        assertSame(next, guarded.get("t1"), "The recomputed snapshot is cached normally");
    }

    @Test
    void testEvictExpiredDropsStaleEntriesButKeepsFallback() {
        when(aggregator.computeSnapshot("t1"))
            .thenAnswer(inv -> snapshotAt("t1"))
            .thenThrow(new AggregationException("t1", "db down"));

        MetricsSnapshot good = cache.get("t1");
        clock.advance(TTL);
        cache.evictExpired();

        assertEquals(0, cache.size());
        assertSame(good, cache.get("t1"), "Last good snapshot survives within the stale retention");
    }

    @Test
    void testEvictExpiredForgetsIdleTenants() {
        when(aggregator.computeSnapshot(anyString())).thenAnswer(inv -> snapshotAt(inv.getArgument(0)));
        for (int i = 0; i < 100; i++) {
            cache.get("tenant-" + i);
        }
        cache.invalidate("tenant-0");
        cache.invalidate("never-computed");
        assertEquals(101, cache.trackedTenants());

        clock.advance(MetricsCache.DEFAULT_STALE_RETENTION);
        int forgotten = cache.evictExpired();

        assertEquals(100, forgotten);
        assertEquals(0, cache.size());
        assertEquals(0, cache.trackedTenants(), "No per-tenant state may outlive the retention");
    }

    @Test
    void testEvictExpiredKeepsFreshTenants() {
        when(aggregator.computeSnapshot(anyString())).thenAnswer(inv -> snapshotAt(inv.getArgument(0)));
        MetricsSnapshot idle = cache.get("idle");
        clock.advance(MetricsCache.DEFAULT_STALE_RETENTION.minusSeconds(1));
        MetricsSnapshot active = cache.get("active");

        clock.advance(Duration.ofSeconds(1));
        cache.evictExpired();

        assertEquals(1, cache.trackedTenants());
        assertSame(active, cache.get("active"));
        assertNotSame(idle, cache.get("idle"), "Forgotten tenant is recomputed from scratch");
    }

    @Test
    void testStaleRetentionShorterThanTtlRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new MetricsCache(aggregator, TTL, Duration.ofSeconds(1), clock, RealtimeMetrics.noop()));
    }
}
