package in.opsboard.realtime;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.PartitionKey;
import in.opsboard.domain.realtime.RealtimeEvent;
import in.opsboard.infrastructure.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authoritative set of live connections, partitioned by (tenant, channel[, subKey]).
 *
 * Locking is per partition: every mutation runs inside {@code compute}/{@code computeIfPresent} on
 * the partition's key, so two partitions never contend. A partition exists only while it has at
 * least one member.
 *
 * Duplicate registration is a no-op ({@link #register} returns false). Deregistering an unknown
 * connection or partition is a no-op as well.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    // PartitionKey -> members
    private final ConcurrentMap<PartitionKey, Set<Connection>> partitions = new ConcurrentHashMap<>();

    private final RealtimeMetrics metrics;

    public ConnectionRegistry(RealtimeMetrics metrics) {
        this.metrics = metrics;
    }

    public ConnectionRegistry() {
        this(RealtimeMetrics.noop());
    }

    /**
     * Add a connection to its partition, creating the partition if absent.
     *
     * @return true if added, false if the connection was already registered there
     */
    public boolean register(Connection connection, PartitionKey key) {
        AtomicBoolean added = new AtomicBoolean(false);
        partitions.compute(key, (k, members) -> {
            Set<Connection> set = members != null ? members : ConcurrentHashMap.newKeySet();
            added.set(set.add(connection));
            return set;
        });

        if (added.get()) {
            metrics.connectionRegistered(key.channel());
            log.debug("[REGISTRY] + {} -> {} (size={})", connection.id(), key, count(key));
        } else {
            log.debug("[REGISTRY] duplicate register ignored: {} -> {}", connection.id(), key);
        }
        return added.get();
    }

    /**
     * Remove a connection. The partition entry is dropped once it becomes empty.
     *
     * @return true if the connection was present and removed
     */
    public boolean deregister(Connection connection, PartitionKey key) {
        AtomicBoolean removed = new AtomicBoolean(false);
        partitions.computeIfPresent(key, (k, members) -> {
            removed.set(members.remove(connection));
            return members.isEmpty() ? null : members;
        });

        if (removed.get()) {
            metrics.connectionDeregistered(key.channel());
            log.debug("[REGISTRY] - {} <- {} (size={})", connection.id(), key, count(key));
        }
        return removed.get();
    }

    /**
     * Send an event to every connection registered in the partition at call time.
     *
     * A failing connection does not stop delivery to the rest; failures are evicted and closed after
     * the pass. An unknown partition is not an error.
     *
     * @return number of connections the frame was handed to
     */
    public int broadcast(PartitionKey key, RealtimeEvent event) {
        Set<Connection> members = partitions.get(key);
        if (members == null) {
            log.trace("[REGISTRY] broadcast {} to {}: no partition", event.kind().wireName(), key);
            return 0;
        }
        List<Connection> targets = List.copyOf(members);
        if (targets.isEmpty()) {
            return 0;
        }

        String frame;
        try {
            frame = ProtocolFrames.encode(event);
        } catch (IllegalArgumentException e) {
            log.warn("[REGISTRY] dropping {} for {}: {}", event.kind().wireName(), key, e.getMessage());
            return 0;
        }

        long startNanos = System.nanoTime();
        int delivered = 0;
        List<Connection> failed = new ArrayList<>();
        for (Connection connection : targets) {
            if (!connection.isOpen()) {
                failed.add(connection);
                continue;
            }
            try {
                connection.send(frame);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("[REGISTRY] send to {} in {} failed: {}", connection.id(), key, e.getMessage());
                failed.add(connection);
            }
        }

        // Evict only after the pass.
        for (Connection connection : failed) {
            deregister(connection, key);
            connection.close();
        }

        metrics.recordBroadcast(event.kind(), delivered, failed.size(), Duration.ofNanos(System.nanoTime() - startNanos));
        log.debug("[REGISTRY] {} -> {}: delivered={}, evicted={}", event.kind().wireName(), key, delivered, failed.size());
        return delivered;
    }

    /**
     * Current size of a partition; 0 if it does not exist.
     */
    public int count(PartitionKey key) {
        Set<Connection> members = partitions.get(key);
        return members == null ? 0 : members.size();
    }

    /**
     * Keys of every live partition of a tenant on one channel, qualified or not.
     */
    public List<PartitionKey> partitionsOf(String tenantId, ChannelKind channel) {
        List<PartitionKey> keys = new ArrayList<>();
        for (PartitionKey key : partitions.keySet()) {
            if (key.channel() == channel && key.tenantId().equals(tenantId)) {
                keys.add(key);
            }
        }
        return keys;
    }

    /**
     * Point-in-time view of active partitions and their sizes.
     */
    public Map<PartitionKey, Integer> activePartitions() {
        Map<PartitionKey, Integer> view = new LinkedHashMap<>();
        for (Map.Entry<PartitionKey, Set<Connection>> entry : partitions.entrySet()) {
            int size = entry.getValue().size();
            if (size > 0) {
                view.put(entry.getKey(), size);
            }
        }
        return view;
    }

    public int partitionCount() {
        return partitions.size();
    }

    public int totalConnections() {
        int total = 0;
        for (Set<Connection> members : partitions.values()) {
            total += members.size();
        }
        return total;
    }
}
