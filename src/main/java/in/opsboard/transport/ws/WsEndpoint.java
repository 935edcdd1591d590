package in.opsboard.transport.ws;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.infrastructure.metrics.RealtimeMetrics;
import in.opsboard.realtime.ConnectionRegistry;
import in.opsboard.realtime.ConnectionSession;
import in.opsboard.realtime.MetricsCache;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Undertow-native WebSocket endpoints, one handshake handler per channel:
 * - /api/v1/ws/dashboard/{businessId}
 * - /api/v1/ws/kds/{businessId}?station=grill
 * - /api/v1/ws/tables/{businessId}?location_id=...
 *
 * Admission is unconditional unless a shared token is configured, in which case the handshake must
 * carry ?token=... . Every accepted channel gets its own {@link ConnectionSession}.
 */
public final class WsEndpoint {
    private static final Logger log = LoggerFactory.getLogger(WsEndpoint.class);

    static final String TENANT_PARAM = "businessId";
    static final String STATION_PARAM = "station";
    static final String LOCATION_PARAM = "location_id";
    static final String TOKEN_PARAM = "token";

    private final ConnectionRegistry registry;
    private final MetricsCache metricsCache;
    private final ScheduledExecutorService scheduler;
    private final Duration idleTimeout;
    private final int maxPendingFrames;
    private final String requiredToken;
    private final Clock clock;
    private final RealtimeMetrics metrics;

    // Channel -> Session
    private final ConcurrentMap<WebSocketChannel, ConnectionSession> sessions = new ConcurrentHashMap<>();

    public WsEndpoint(ConnectionRegistry registry, MetricsCache metricsCache, ScheduledExecutorService scheduler,
                      Duration idleTimeout, int maxPendingFrames, String requiredToken,
                      Clock clock, RealtimeMetrics metrics) {
        this.registry = registry;
        this.metricsCache = metricsCache;
        this.scheduler = scheduler;
        this.idleTimeout = idleTimeout;
        this.maxPendingFrames = maxPendingFrames;
        this.requiredToken = requiredToken == null ? "" : requiredToken.trim();
        this.clock = clock;
        this.metrics = metrics;
    }

    public WebSocketProtocolHandshakeHandler dashboardHandler() {
        return handler(ChannelKind.DASHBOARD, null);
    }

    public WebSocketProtocolHandshakeHandler kitchenDisplayHandler() {
        return handler(ChannelKind.KITCHEN_DISPLAY, STATION_PARAM);
    }

    public WebSocketProtocolHandshakeHandler tableViewHandler() {
        return handler(ChannelKind.TABLE_VIEW, LOCATION_PARAM);
    }

    private WebSocketProtocolHandshakeHandler handler(ChannelKind channelKind, String subKeyParam) {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                accept(exchange, channel, channelKind, subKeyParam);
            }
        });
    }

    private void accept(WebSocketHttpExchange exchange, WebSocketChannel channel,
                        ChannelKind channelKind, String subKeyParam) {
        Map<String, List<String>> params = exchange.getRequestParameters();
        String tenantId = firstParam(params, TENANT_PARAM);

        if (tenantId == null || tenantId.isBlank()) {
            log.warn("[WS] {} connection rejected: missing business id from {}", channelKind.wireName(), channel.getSourceAddress());
            reject(channel, "business id required");
            return;
        }
        if (!isAdmitted(params)) {
            log.warn("[WS] {} connection rejected for {}: invalid or missing token from {}",
                channelKind.wireName(), tenantId, channel.getSourceAddress());
            reject(channel, "invalid token");
            return;
        }

        String subKey = subKeyParam == null ? null : firstParam(params, subKeyParam);
        WsConnection connection = new WsConnection(channel, tenantId, channelKind, subKey, maxPendingFrames);
        ConnectionSession session = new ConnectionSession(
            connection, registry, metricsCache, scheduler, idleTimeout, clock, metrics);
        sessions.put(channel, session);

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                session.onText(message.getData());
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                session.onPeerClosed();
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                session.onTransportError(error);
                super.onError(ch, error);
            }
        });
        channel.getCloseSetter().set(c -> {
            sessions.remove(channel);
            session.onPeerClosed();
        });

        // Snapshot may hit the database: keep it off the IO thread.
        channel.getWorker().execute(() -> {
            session.open();
            if (!session.isClosed()) {
                channel.resumeReceives();
            }
        });
    }

    private boolean isAdmitted(Map<String, List<String>> params) {
        if (requiredToken.isEmpty()) {
            return true;
        }
        return requiredToken.equals(firstParam(params, TOKEN_PARAM));
    }

    private static String firstParam(Map<String, List<String>> params, String name) {
        if (params == null) {
            return null;
        }
        List<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void reject(WebSocketChannel channel, String reason) {
        WebSockets.sendClose(CloseMessage.MSG_VIOLATES_POLICY, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                IoUtils.safeClose(ch);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("[WS] close frame to rejected peer failed: {}", throwable.toString());
                IoUtils.safeClose(ch);
            }
        });
    }

    /**
     * Close every live session (server shutdown).
     */
    public void closeAll() {
        List<ConnectionSession> open = new ArrayList<>(sessions.values());
        for (ConnectionSession session : open) {
            session.close();
        }
        sessions.clear();
        log.info("[WS] closed {} session(s)", open.size());
    }
}
