package in.opsboard.realtime;

import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.domain.realtime.PartitionKey;
import in.opsboard.domain.realtime.RealtimeEvent;
import in.opsboard.infrastructure.metrics.RealtimeMetrics;
import in.opsboard.realtime.ProtocolFrames.ClientMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection protocol state machine.
 *
 * CONNECTING -> CONNECTED -> {IDLE, PROCESSING} -> CLOSED
 *
 * - open(): register, send "connected" with the tenant snapshot, arm the idle timer
 * - ping: reply pong; subscribe: recorded, not enforced; anything else: ignored
 * - idle timeout: send heartbeat and re-arm (never closes the connection by itself)
 * - peer close, transport error or failed write: close(), which always deregisters
 *
 * Client frames and idle timeouts are handled under one session lock, so a pong is never overtaken
 * by a heartbeat. close() takes no lock and may be called from any thread.
 */
public final class ConnectionSession {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);

    private final Connection connection;
    private final PartitionKey partitionKey;
    private final ConnectionRegistry registry;
    private final MetricsCache metricsCache;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final IdleHeartbeatTimer idleTimer;

    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile SessionState state = SessionState.CONNECTING;

    // Accepted but not used to filter broadcasts.
    private final Set<String> subscribedEvents = ConcurrentHashMap.newKeySet();
    private final Instant connectedAt;

    public ConnectionSession(Connection connection,
                             ConnectionRegistry registry,
                             MetricsCache metricsCache,
                             ScheduledExecutorService scheduler,
                             Duration idleTimeout,
                             Clock clock,
                             RealtimeMetrics metrics) {
        this.connection = connection;
        this.partitionKey = new PartitionKey(connection.tenantId(), connection.channel(), connection.subKey());
        this.registry = registry;
        this.metricsCache = metricsCache;
        this.metrics = metrics;
        this.clock = clock;
        this.idleTimer = new IdleHeartbeatTimer(connection.id(), scheduler, idleTimeout, this::onIdleTimeout);
        this.connectedAt = clock.instant();
    }

    /**
     * Register with the registry and deliver the initial snapshot. Any failure closes the session.
     * A session already closed by its peer is left unregistered.
     */
    public void open() {
        synchronized (lock) {
            if (closed.get()) {
                log.debug("[WS] {} closed before open, skipping registration", connection.id());
                return;
            }
            if (state != SessionState.CONNECTING) {
                throw new IllegalStateException("Session " + connection.id() + " already opened (state=" + state + ")");
            }
            try {
                registry.register(connection, partitionKey);
                // A close() that ran before register() has already done its deregister.
                if (closed.get()) {
                    registry.deregister(connection, partitionKey);
                    return;
                }
                state = SessionState.CONNECTED;

                MetricsSnapshot snapshot = metricsCache.get(connection.tenantId());
                send(RealtimeEvent.connected(clock.instant(), ProtocolFrames.toTree(snapshot)));

                if (closed.get()) {
                    return;
                }
                state = SessionState.IDLE;
                idleTimer.arm();
                log.info("[WS] connected: {} ({})", connection.id(), partitionKey);
            } catch (RuntimeException e) {
                log.warn("[WS] handshake for {} ({}) failed: {}", connection.id(), partitionKey, e.getMessage());
                close();
                // A concurrent close() may have deregistered before our register() landed.
                registry.deregister(connection, partitionKey);
            }
        }
    }

    /**
     * Handle one inbound text frame.
     */
    public void onText(String raw) {
        synchronized (lock) {
            if (closed.get() || state == SessionState.CONNECTING) {
                return;
            }
            idleTimer.disarm();
            state = SessionState.PROCESSING;

            try {
                handle(raw);
            } catch (ConnectionSendException e) {
                log.warn("[WS] reply to {} failed: {}", connection.id(), e.getMessage());
                close();
                return;
            } catch (RuntimeException e) {
                log.error("[WS] unexpected error on {}, closing", connection.id(), e);
                close();
                return;
            }

            if (!closed.get()) {
                state = SessionState.IDLE;
                idleTimer.arm();
            }
        }
    }

    /**
     * Idle timer callback. Ignored if a client frame re-armed the timer since it was scheduled.
     */
    void onIdleTimeout(long generation) {
        synchronized (lock) {
            if (closed.get() || state != SessionState.IDLE || !idleTimer.isCurrent(generation)) {
                return;
            }
            try {
                send(RealtimeEvent.heartbeat(clock.instant()));
                metrics.recordHeartbeat();
            } catch (RuntimeException e) {
                log.warn("[WS] heartbeat to {} failed: {}", connection.id(), e.getMessage());
                close();
                return;
            }
            idleTimer.arm();
        }
    }

    public void onPeerClosed() {
        log.debug("[WS] peer closed {}", connection.id());
        close();
    }

    public void onTransportError(Throwable error) {
        log.warn("[WS] transport error on {}: {}", connection.id(), error.toString());
        close();
    }

    /**
     * Terminal transition. Idempotent; always deregisters, whatever caused the close.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        state = SessionState.CLOSED;
        idleTimer.disarm();
        try {
            registry.deregister(connection, partitionKey);
        } finally {
            connection.close();
            log.info("[WS] disconnected: {} ({}) after {}s", connection.id(), partitionKey,
                Duration.between(connectedAt, clock.instant()).toSeconds());
        }
    }

    private void handle(String raw) {
        Optional<ClientMessage> parsed = ProtocolFrames.parseClientMessage(raw);
        if (parsed.isEmpty()) {
            metrics.recordMalformedFrame();
            log.debug("[WS] ignoring malformed frame from {}", connection.id());
            return;
        }

        ClientMessage message = parsed.get();
        switch (message.type()) {
            case PING -> send(RealtimeEvent.pong(clock.instant()));
            case SUBSCRIBE -> {
                subscribedEvents.addAll(message.events());
                log.debug("[WS] {} subscribed to {}", connection.id(), message.events());
            }
            case UNKNOWN -> {
                metrics.recordMalformedFrame();
                log.debug("[WS] ignoring unknown frame type '{}' from {}", message.rawType(), connection.id());
            }
        }
    }

    private void send(RealtimeEvent event) {
        connection.send(ProtocolFrames.encode(event));
    }

    public PartitionKey partitionKey() {
        return partitionKey;
    }

    public SessionState state() {
        return state;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Set<String> subscribedEvents() {
        return Set.copyOf(subscribedEvents);
    }
}
