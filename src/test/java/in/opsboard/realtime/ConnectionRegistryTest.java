package in.opsboard.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.EventKind;
import in.opsboard.domain.realtime.PartitionKey;
import in.opsboard.domain.realtime.RealtimeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionRegistry.
 *
 * Tests:
 * - Partition counts across register/deregister
 * - No empty partitions left behind
 * - Tenant isolation
 * - Failure eviction without aborting the broadcast
 * - Idempotent deregister, duplicate register
 * - Concurrent register/deregister/broadcast
 */
class ConnectionRegistryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    private static RealtimeEvent orderEvent(String orderId) {
        JsonNode data = ProtocolFrames.mapper().createObjectNode()
            .put("type", "created")
            .put("order_id", orderId);
        return RealtimeEvent.domain(EventKind.ORDER_UPDATE, NOW, data);
    }

    @Test
    void testCountTracksRegisterAndDeregister() {
        PartitionKey key = PartitionKey.dashboard("t1");
        FakeConnection a = new FakeConnection("t1", ChannelKind.DASHBOARD);
        FakeConnection b = new FakeConnection("t1", ChannelKind.DASHBOARD);

        assertEquals(0, registry.count(key));
        assertTrue(registry.register(a, key));
        assertTrue(registry.register(b, key));
        assertEquals(2, registry.count(key));

        assertTrue(registry.deregister(a, key));
        assertEquals(1, registry.count(key));
        assertEquals(1, registry.totalConnections());
    }

    @Test
    void testEmptyPartitionIsRemoved() {
        PartitionKey key = PartitionKey.kitchenDisplay("t1", "grill");
        FakeConnection a = new FakeConnection("t1", ChannelKind.KITCHEN_DISPLAY, "grill");

        registry.register(a, key);
        assertEquals(1, registry.partitionCount());

        registry.deregister(a, key);
        assertEquals(0, registry.partitionCount(), "Partition entry should be dropped once empty");
        assertTrue(registry.activePartitions().isEmpty());
    }

    @Test
    void testDeregisterIsIdempotent() {
        PartitionKey key = PartitionKey.dashboard("t1");
        FakeConnection a = new FakeConnection("t1", ChannelKind.DASHBOARD);
        registry.register(a, key);

        assertTrue(registry.deregister(a, key));
        assertFalse(registry.deregister(a, key), "Second deregister is a no-op");
        assertFalse(registry.deregister(new FakeConnection("t1", ChannelKind.DASHBOARD), PartitionKey.dashboard("nobody")));
        assertEquals(0, registry.count(key));
    }

    @Test
    void testDuplicateRegisterIsIgnored() {
        PartitionKey key = PartitionKey.dashboard("t1");
        FakeConnection a = new FakeConnection("t1", ChannelKind.DASHBOARD);

        assertTrue(registry.register(a, key));
        assertFalse(registry.register(a, key));
        assertEquals(1, registry.count(key));

        registry.broadcast(key, orderEvent("o-1"));
        assertEquals(1, a.frames.size(), "Duplicate registration must not double-deliver");
    }

    @Test
    void testBroadcastIsIsolatedPerTenant() {
        FakeConnection t1 = new FakeConnection("t1", ChannelKind.DASHBOARD);
        FakeConnection t2 = new FakeConnection("t2", ChannelKind.DASHBOARD);
        registry.register(t1, PartitionKey.dashboard("t1"));
        registry.register(t2, PartitionKey.dashboard("t2"));

        int delivered = registry.broadcast(PartitionKey.dashboard("t1"), orderEvent("o-1"));

        assertEquals(1, delivered);
        assertEquals(1, t1.frames.size());
        assertTrue(t2.frames.isEmpty(), "Other tenant must receive nothing");
    }

    @Test
    void testBroadcastToUnknownPartitionReturnsZero() {
        assertEquals(0, registry.broadcast(PartitionKey.dashboard("ghost"), orderEvent("o-1")));
        assertEquals(0, registry.partitionCount(), "Broadcast must not create partitions");
    }

    @Test
    void testFailedConnectionIsEvictedAndOthersStillReceive() {
        PartitionKey key = PartitionKey.dashboard("t1");
        FakeConnection good1 = new FakeConnection("t1", ChannelKind.DASHBOARD);
        FakeConnection bad = new FakeConnection("t1", ChannelKind.DASHBOARD);
        FakeConnection good2 = new FakeConnection("t1", ChannelKind.DASHBOARD);
        registry.register(good1, key);
        registry.register(bad, key);
        registry.register(good2, key);
        bad.failSends();

        int delivered = registry.broadcast(key, orderEvent("o-1"));

        assertEquals(2, delivered);
        assertEquals(1, good1.frames.size());
        assertEquals(1, good2.frames.size());
        assertEquals(2, registry.count(key), "Failing connection should be evicted");
        assertEquals(1, bad.closeCalls.get(), "Evicted connection should be closed");

        assertEquals(2, registry.broadcast(key, orderEvent("o-2")));
        assertEquals(2, good1.frames.size());
    }

    @Test
    void testBroadcastFrameFormat() throws Exception {
        PartitionKey key = PartitionKey.dashboard("t1");
        FakeConnection a = new FakeConnection("t1", ChannelKind.DASHBOARD);
        registry.register(a, key);

        registry.broadcast(key, orderEvent("o-9"));

        JsonNode frame = ProtocolFrames.mapper().readTree(a.lastFrame());
        assertEquals("order_update", frame.get("event").asText());
        assertEquals("2024-05-01T12:00:00Z", frame.get("timestamp").asText());
        assertEquals("o-9", frame.get("data").get("order_id").asText());
    }

    @Test
    void testPartitionsOfAndActivePartitions() {
        registry.register(new FakeConnection("t1", ChannelKind.KITCHEN_DISPLAY), PartitionKey.kitchenDisplay("t1", null));
        registry.register(new FakeConnection("t1", ChannelKind.KITCHEN_DISPLAY, "grill"), PartitionKey.kitchenDisplay("t1", "grill"));
        registry.register(new FakeConnection("t1", ChannelKind.DASHBOARD), PartitionKey.dashboard("t1"));
        registry.register(new FakeConnection("t2", ChannelKind.KITCHEN_DISPLAY), PartitionKey.kitchenDisplay("t2", null));

        List<PartitionKey> kitchens = registry.partitionsOf("t1", ChannelKind.KITCHEN_DISPLAY);
        assertEquals(2, kitchens.size());
        assertTrue(kitchens.contains(PartitionKey.kitchenDisplay("t1", "grill")));
        assertTrue(kitchens.contains(PartitionKey.kitchenDisplay("t1", null)));

        Map<PartitionKey, Integer> active = registry.activePartitions();
        assertEquals(4, active.size());
        assertEquals(1, active.get(PartitionKey.dashboard("t1")));
    }

    @Test
    void testConcurrentRegisterDeregisterAndBroadcast() throws Exception {
        PartitionKey key = PartitionKey.dashboard("t1");
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<FakeConnection> survivors = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            FakeConnection keeper = new FakeConnection("t1", ChannelKind.DASHBOARD);
            survivors.add(keeper);
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        FakeConnection c = new FakeConnection("t1", ChannelKind.DASHBOARD);
                        registry.register(c, key);
                        registry.deregister(c, key);
                    }
                    registry.register(keeper, key);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        pool.submit(() -> {
            while (done.getCount() > 0) {
                registry.broadcast(key, orderEvent("o-x"));
            }
        });

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(threads, registry.count(key), "Only the keepers should remain");
        assertEquals(threads, registry.broadcast(key, orderEvent("final")));
        for (FakeConnection keeper : survivors) {
            assertTrue(keeper.lastFrame().contains("final"));
        }
    }
}
