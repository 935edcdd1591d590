package in.opsboard.domain.realtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, timestamped event. Constructed, broadcast and discarded; never persisted.
 */
public record RealtimeEvent(
    EventKind kind,
    Instant timestamp,
    JsonNode data           // null for pong/heartbeat
) {
    public RealtimeEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static RealtimeEvent domain(EventKind kind, Instant timestamp, JsonNode data) {
        if (kind.isProtocol()) {
            throw new IllegalArgumentException(kind.wireName() + " is a protocol event");
        }
        return new RealtimeEvent(kind, timestamp, data);
    }

    public static RealtimeEvent connected(Instant timestamp, JsonNode snapshot) {
        return new RealtimeEvent(EventKind.CONNECTED, timestamp, snapshot);
    }

    public static RealtimeEvent pong(Instant timestamp) {
        return new RealtimeEvent(EventKind.PONG, timestamp, null);
    }

    public static RealtimeEvent heartbeat(Instant timestamp) {
        return new RealtimeEvent(EventKind.HEARTBEAT, timestamp, null);
    }
}
