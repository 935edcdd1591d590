package in.opsboard.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.opsboard.domain.realtime.EventKind;
import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.domain.realtime.PartitionKey;
import in.opsboard.realtime.ConnectionRegistry;
import in.opsboard.realtime.EventPublisher;
import in.opsboard.realtime.MetricsCache;
import in.opsboard.realtime.ProtocolFrames;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * HTTP handlers for the realtime layer.
 *
 * - GET  /api/health - status, connection and partition counts
 * - GET  /api/v1/analytics/real-time/{businessId} - cached metrics snapshot
 * - GET  /api/v1/realtime/partitions - active partitions with connection counts
 * - POST /api/v1/realtime/{businessId}/events/{eventKind} - publish a domain event
 */
public final class RealtimeApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(RealtimeApiHandlers.class);
    private static final ObjectMapper MAPPER = ProtocolFrames.mapper();

    private final ConnectionRegistry registry;
    private final MetricsCache metricsCache;
    private final EventPublisher publisher;

    public RealtimeApiHandlers(ConnectionRegistry registry, MetricsCache metricsCache, EventPublisher publisher) {
        this.registry = registry;
        this.metricsCache = metricsCache;
        this.publisher = publisher;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "ok");
        body.put("connections", registry.totalConnections());
        body.put("partitions", registry.partitionCount());
        body.put("cached_snapshots", metricsCache.size());
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /api/v1/analytics/real-time/{businessId}
     *
     * A cache miss runs the aggregation queries, so the request leaves the IO thread first.
     */
    public void getRealtimeAnalytics(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::getRealtimeAnalytics);
            return;
        }
        String businessId = pathParam(exchange, "businessId");
        try {
            MetricsSnapshot snapshot = metricsCache.get(businessId);
            sendJson(exchange, StatusCodes.OK, MAPPER.valueToTree(snapshot));
        } catch (Exception e) {
            log.error("Failed to get real-time analytics for {}: {}", businessId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to fetch real-time analytics");
        }
    }

    /**
     * GET /api/v1/realtime/partitions
     */
    public void listPartitions(HttpServerExchange exchange) {
        ArrayNode partitions = MAPPER.createArrayNode();
        for (Map.Entry<PartitionKey, Integer> entry : registry.activePartitions().entrySet()) {
            PartitionKey key = entry.getKey();
            ObjectNode node = partitions.addObject();
            node.put("business_id", key.tenantId());
            node.put("channel", key.channel().wireName());
            if (key.subKey() != null) {
                node.put("sub_key", key.subKey());
            }
            node.put("connections", entry.getValue());
        }
        ObjectNode body = MAPPER.createObjectNode();
        body.put("total_connections", registry.totalConnections());
        body.set("partitions", partitions);
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * POST /api/v1/realtime/{businessId}/events/{eventKind}
     *
     * Body is the event's data object. For kds_update, a "station" field is used as the routing hint.
     * Responds 202 with the number of connections reached, 400 for an unknown or protocol kind or a
     * body that is not a JSON object.
     */
    public void ingestEvent(HttpServerExchange exchange) {
        String businessId = pathParam(exchange, "businessId");
        String kindName = pathParam(exchange, "eventKind");

        EventKind kind;
        try {
            kind = EventKind.fromWireName(kindName);
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Unknown event kind: " + kindName);
            return;
        }
        if (kind.isProtocol()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Event kind cannot be published: " + kindName);
            return;
        }

        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            JsonNode data;
            try {
                data = MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "Invalid JSON body");
                return;
            }
            if (data == null || !data.isObject()) {
                sendError(ex, StatusCodes.BAD_REQUEST, "Event body must be a JSON object");
                return;
            }

            try {
                String station = data.hasNonNull("station") ? data.get("station").asText() : null;
                int delivered = publisher.publish(businessId, kind, data, station);

                ObjectNode response = MAPPER.createObjectNode();
                response.put("accepted", true);
                response.put("event", kind.wireName());
                response.put("delivered", delivered);
                sendJson(ex, StatusCodes.ACCEPTED, response);
            } catch (Exception e) {
                log.error("[PUBLISH] Failed to publish {} for {}: {}", kindName, businessId, e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to publish event");
            }
        }, StandardCharsets.UTF_8);
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        if (match != null && match.getParameters().containsKey(name)) {
            return match.getParameters().get(name);
        }
        return exchange.getQueryParameters().containsKey(name)
            ? exchange.getQueryParameters().get(name).getFirst()
            : null;
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", message);
        sendJson(exchange, status, body);
    }
}
