package in.opsboard.bootstrap;

import in.opsboard.config.RealtimeConfig;
import in.opsboard.infrastructure.metrics.PrometheusMetricsHandler;
import in.opsboard.infrastructure.metrics.PrometheusRealtimeMetrics;
import in.opsboard.realtime.ConnectionRegistry;
import in.opsboard.realtime.EventPublisher;
import in.opsboard.realtime.MetricsCache;
import in.opsboard.realtime.SnapshotAggregator;
import in.opsboard.transport.http.RealtimeApiHandlers;
import in.opsboard.transport.ws.WsEndpoint;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the realtime components and serves them over one Undertow listener.
 */
public final class RealtimeServer {
    private static final Logger log = LoggerFactory.getLogger(RealtimeServer.class);

    private final RealtimeConfig config;
    private final PrometheusRealtimeMetrics metrics;
    private final ConnectionRegistry registry;
    private final MetricsCache metricsCache;
    private final EventPublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final WsEndpoint wsEndpoint;

    private Undertow server;

    public RealtimeServer(RealtimeConfig config, SnapshotAggregator aggregator,
                          PrometheusRealtimeMetrics metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;

        // ═══════════════════════════════════════════════════════════════
        // Core: registry, snapshot cache, publisher
        // ═══════════════════════════════════════════════════════════════
        this.registry = new ConnectionRegistry(metrics);
        this.metricsCache = new MetricsCache(aggregator, config.metricsCacheTtl(), clock, metrics);
        this.publisher = new EventPublisher(registry, metricsCache, clock, config.kdsStationRouting());

        // ═══════════════════════════════════════════════════════════════
        // WebSocket sessions
        // ═══════════════════════════════════════════════════════════════
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "realtime-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.wsEndpoint = new WsEndpoint(registry, metricsCache, scheduler, config.idleTimeout(),
            config.maxPendingFrames(), config.wsToken(), clock, metrics);
    }

    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        RealtimeApiHandlers api = new RealtimeApiHandlers(registry, metricsCache, publisher);

        RoutingHandler routes = Handlers.routing()
            .get("/api/health", api::health)
            .get("/api/v1/analytics/real-time/{businessId}", api::getRealtimeAnalytics)
            .get("/api/v1/realtime/partitions", api::listPartitions)
            .post("/api/v1/realtime/{businessId}/events/{eventKind}", api::ingestEvent)
            .get("/api/v1/ws/dashboard/{businessId}", wsEndpoint.dashboardHandler())
            .get("/api/v1/ws/kds/{businessId}", wsEndpoint.kitchenDisplayHandler())
            .get("/api/v1/ws/tables/{businessId}", wsEndpoint.tableViewHandler())
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        long sweepMillis = config.metricsCacheTtl().toMillis();
        scheduler.scheduleAtFixedRate(this::sweepMetricsCache, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();

        log.info("✓ Realtime server started on http://localhost:{}/ (idleTimeout={}, cacheTtl={}, token={})",
            config.port(), config.idleTimeout(), config.metricsCacheTtl(),
            config.requiresToken() ? "required" : "off");
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        log.info("Stopping realtime server...");
        wsEndpoint.closeAll();
        server.stop();
        server = null;

        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Realtime scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("✓ Realtime server stopped");
    }

    private void sweepMetricsCache() {
        try {
            metricsCache.evictExpired();
        } catch (RuntimeException e) {
            log.error("[CACHE] eviction sweep failed", e);
        }
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public EventPublisher publisher() {
        return publisher;
    }
}
