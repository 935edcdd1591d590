package in.opsboard.infrastructure.metrics;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.EventKind;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of RealtimeMetrics.
 *
 * Key Metrics:
 * - realtime_connections{channel} - Live connections per channel
 * - realtime_broadcasts_total{event} - Broadcast passes
 * - realtime_deliveries_total{event, outcome} - Per-connection outcomes (delivered/failed)
 * - realtime_broadcast_latency_seconds - Fan-out loop duration
 * - realtime_snapshot_cache_total{result} - hit / miss / stale / empty
 * - realtime_heartbeats_total - Idle heartbeats sent
 * - realtime_malformed_frames_total - Client frames ignored
 *
 * Usage:
 * <pre>
 * PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
 * ConnectionRegistry registry = new ConnectionRegistry(metrics);
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRealtimeMetrics implements RealtimeMetrics {

    private final CollectorRegistry registry;

    private final Gauge connections;
    private final Counter broadcasts;
    private final Counter deliveries;
    private final Histogram broadcastLatency;
    private final Counter snapshotCache;
    private final Counter heartbeats;
    private final Counter malformedFrames;

    public PrometheusRealtimeMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRealtimeMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connections = Gauge.build()
            .name("realtime_connections")
            .help("Live realtime connections")
            .labelNames("channel")
            .register(registry);

        this.broadcasts = Counter.build()
            .name("realtime_broadcasts_total")
            .help("Total number of broadcast passes")
            .labelNames("event")
            .register(registry);

        this.deliveries = Counter.build()
            .name("realtime_deliveries_total")
            .help("Per-connection delivery outcomes")
            .labelNames("event", "outcome")
            .register(registry);

        this.broadcastLatency = Histogram.build()
            .name("realtime_broadcast_latency_seconds")
            .help("Time spent fanning one event out to a partition")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
            .register(registry);

        this.snapshotCache = Counter.build()
            .name("realtime_snapshot_cache_total")
            .help("Snapshot cache lookups by result")
            .labelNames("result")
            .register(registry);

        this.heartbeats = Counter.build()
            .name("realtime_heartbeats_total")
            .help("Heartbeat frames sent to idle connections")
            .register(registry);

        this.malformedFrames = Counter.build()
            .name("realtime_malformed_frames_total")
            .help("Client frames ignored as malformed or unknown")
            .register(registry);

        // Zero-initialise so every channel shows up before its first connection.
        for (ChannelKind channel : ChannelKind.values()) {
            connections.labels(channel.wireName()).set(0);
        }
    }

    @Override
    public void connectionRegistered(ChannelKind channel) {
        connections.labels(channel.wireName()).inc();
    }

    @Override
    public void connectionDeregistered(ChannelKind channel) {
        connections.labels(channel.wireName()).dec();
    }

    @Override
    public void recordBroadcast(EventKind kind, int delivered, int failed, Duration latency) {
        String event = kind.wireName();
        broadcasts.labels(event).inc();
        if (delivered > 0) {
            deliveries.labels(event, "delivered").inc(delivered);
        }
        if (failed > 0) {
            deliveries.labels(event, "failed").inc(failed);
        }
        broadcastLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordCacheHit() {
        snapshotCache.labels("hit").inc();
    }

    @Override
    public void recordCacheMiss() {
        snapshotCache.labels("miss").inc();
    }

    @Override
    public void recordAggregationFailure(boolean servedStale) {
        snapshotCache.labels(servedStale ? "stale" : "empty").inc();
    }

    @Override
    public void recordHeartbeat() {
        heartbeats.inc();
    }

    @Override
    public void recordMalformedFrame() {
        malformedFrames.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
