package in.opsboard.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.opsboard.domain.realtime.EventKind;
import in.opsboard.domain.realtime.RealtimeEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON framing for the realtime wire protocol.
 *
 * Server to client:
 * <pre>
 * {"event": "order_update", "timestamp": "2024-05-01T10:15:30Z", "data": {...}}
 * {"type": "pong" | "heartbeat", "timestamp": "..."}
 * </pre>
 * Client to server:
 * <pre>
 * {"type": "ping"}
 * {"type": "subscribe", "events": ["order_update", ...]}
 * </pre>
 */
public final class ProtocolFrames {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ProtocolFrames() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Encode an event. Pong and heartbeat use the "type" envelope, everything else the "event" envelope.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public static String encode(RealtimeEvent event) {
        ObjectNode frame = MAPPER.createObjectNode();
        if (event.kind() == EventKind.PONG || event.kind() == EventKind.HEARTBEAT) {
            frame.put("type", event.kind().wireName());
            frame.put("timestamp", event.timestamp().toString());
        } else {
            frame.put("event", event.kind().wireName());
            frame.put("timestamp", event.timestamp().toString());
            frame.set("data", event.data() == null ? MAPPER.nullNode() : event.data());
        }
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + event.kind().wireName() + " frame", e);
        }
    }

    public static JsonNode toTree(Object pojo) {
        return MAPPER.valueToTree(pojo);
    }

    /**
     * Parse a client frame. Returns empty for non-JSON input or a frame without a string "type".
     */
    public static Optional<ClientMessage> parseClientMessage(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            return Optional.empty();
        }

        List<String> events = new ArrayList<>();
        JsonNode eventsNode = node.get("events");
        if (eventsNode != null && eventsNode.isArray()) {
            for (JsonNode e : eventsNode) {
                if (e.isTextual()) {
                    events.add(e.asText());
                }
            }
        }
        return Optional.of(new ClientMessage(ClientMessage.Type.of(type.asText()), type.asText(), List.copyOf(events)));
    }

    /**
     * Decoded client frame.
     */
    public record ClientMessage(Type type, String rawType, List<String> events) {
        public enum Type {
            PING,
            SUBSCRIBE,
            UNKNOWN;

            static Type of(String value) {
                return switch (value) {
                    case "ping" -> PING;
                    case "subscribe" -> SUBSCRIBE;
                    default -> UNKNOWN;
                };
            }
        }
    }
}
