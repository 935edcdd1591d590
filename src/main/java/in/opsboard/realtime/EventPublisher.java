package in.opsboard.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.EventKind;
import in.opsboard.domain.realtime.PartitionKey;
import in.opsboard.domain.realtime.RealtimeEvent;
import in.opsboard.domain.realtime.payload.EventPayload;
import in.opsboard.domain.realtime.payload.InventoryAlert;
import in.opsboard.domain.realtime.payload.KdsUpdate;
import in.opsboard.domain.realtime.payload.OrderUpdate;
import in.opsboard.domain.realtime.payload.RevenueUpdate;
import in.opsboard.domain.realtime.payload.StaffUpdate;
import in.opsboard.domain.realtime.payload.TableUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed entry points for domain modules. Stamps each event and broadcasts it once per resolved
 * partition. Delivery is best-effort: nothing about individual connections is reported back.
 *
 * Routing:
 * - order_update, inventory_alert, staff_update, revenue_update: (tenant, dashboard)
 * - table_update: (tenant, dashboard) and every (tenant, table-view[, location]) partition
 * - kds_update: every (tenant, kitchen-display[, station]) partition; with station routing enabled,
 *   a station-tagged update only reaches the unqualified partition and that station's partition
 */
public final class EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final ConnectionRegistry registry;
    private final MetricsCache metricsCache;
    private final Clock clock;
    private final boolean kdsStationRouting;

    public EventPublisher(ConnectionRegistry registry, MetricsCache metricsCache, Clock clock, boolean kdsStationRouting) {
        this.registry = registry;
        this.metricsCache = metricsCache;
        this.clock = clock;
        this.kdsStationRouting = kdsStationRouting;
    }

    public EventPublisher(ConnectionRegistry registry, MetricsCache metricsCache) {
        this(registry, metricsCache, Clock.systemUTC(), false);
    }

    // ═══════════════════════════════════════════════════════════════
    // DASHBOARD EVENTS
    // ═══════════════════════════════════════════════════════════════

    public void publishOrderUpdate(String tenantId, OrderUpdate update) {
        publishPayload(tenantId, update, null);
    }

    public void publishInventoryAlert(String tenantId, InventoryAlert alert) {
        publishPayload(tenantId, alert, null);
    }

    public void publishStaffUpdate(String tenantId, StaffUpdate update) {
        publishPayload(tenantId, update, null);
    }

    public void publishRevenueUpdate(String tenantId, RevenueUpdate update) {
        publishPayload(tenantId, update, null);
    }

    public void publishTableUpdate(String tenantId, TableUpdate update) {
        publishPayload(tenantId, update, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // KITCHEN DISPLAY EVENTS
    // ═══════════════════════════════════════════════════════════════

    public void publishKdsUpdate(String tenantId, KdsUpdate update) {
        publishPayload(tenantId, update, update.station());
    }

    // ═══════════════════════════════════════════════════════════════
    // UNTYPED (HTTP ingest)
    // ═══════════════════════════════════════════════════════════════

    /**
     * Publish a pre-encoded payload.
     *
     * @param station station hint, only consulted for kds_update when station routing is enabled
     * @return number of connections the event was handed to
     * @throws IllegalArgumentException for protocol kinds
     */
    public int publish(String tenantId, EventKind kind, JsonNode data, String station) {
        if (kind.isProtocol()) {
            throw new IllegalArgumentException(kind.wireName() + " cannot be published");
        }
        if (kind.affectsSnapshot()) {
            metricsCache.invalidate(tenantId);
        }

        RealtimeEvent event = RealtimeEvent.domain(kind, clock.instant(), data);
        int delivered = 0;
        for (PartitionKey key : resolve(tenantId, kind, station)) {
            delivered += registry.broadcast(key, event);
        }
        log.debug("[PUBLISH] {} for {} delivered to {} connection(s)", kind.wireName(), tenantId, delivered);
        return delivered;
    }

    private void publishPayload(String tenantId, EventPayload payload, String station) {
        publish(tenantId, payload.kind(), ProtocolFrames.toTree(payload), station);
    }

    List<PartitionKey> resolve(String tenantId, EventKind kind, String station) {
        return switch (kind) {
            case ORDER_UPDATE, INVENTORY_ALERT, STAFF_UPDATE, REVENUE_UPDATE -> List.of(PartitionKey.dashboard(tenantId));
            case TABLE_UPDATE -> {
                List<PartitionKey> keys = new ArrayList<>();
                keys.add(PartitionKey.dashboard(tenantId));
                keys.addAll(registry.partitionsOf(tenantId, ChannelKind.TABLE_VIEW));
                yield keys;
            }
            case KDS_UPDATE -> resolveKitchen(tenantId, station);
            case CONNECTED, PONG, HEARTBEAT -> List.of();
        };
    }

    private List<PartitionKey> resolveKitchen(String tenantId, String station) {
        List<PartitionKey> all = registry.partitionsOf(tenantId, ChannelKind.KITCHEN_DISPLAY);
        if (!kdsStationRouting || station == null || station.isBlank()) {
            return all;
        }
        List<PartitionKey> narrowed = new ArrayList<>();
        for (PartitionKey key : all) {
            if (!key.isQualified() || station.equals(key.subKey())) {
                narrowed.add(key);
            }
        }
        return narrowed;
    }
}
