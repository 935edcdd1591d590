package in.opsboard.infrastructure.metrics;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.EventKind;

import java.time.Duration;

/**
 * Realtime layer metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, Grafana, CloudWatch, etc.
 *
 * Key metrics:
 * - Live connections per channel
 * - Broadcast fan-out size, failures and latency
 * - Snapshot cache hit/miss ratio and aggregation failures
 * - Heartbeats sent, malformed client frames
 */
public interface RealtimeMetrics {

    /**
     * Record a connection entering the registry.
     *
     * @param channel Channel the connection belongs to
     */
    void connectionRegistered(ChannelKind channel);

    /**
     * Record a connection leaving the registry.
     *
     * @param channel Channel the connection belonged to
     */
    void connectionDeregistered(ChannelKind channel);

    /**
     * Record one broadcast pass.
     *
     * @param kind Event kind broadcast
     * @param delivered Connections the frame was handed to
     * @param failed Connections that failed and were evicted
     * @param latency Time spent in the fan-out loop
     */
    void recordBroadcast(EventKind kind, int delivered, int failed, Duration latency);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Record an aggregation failure.
     *
     * @param servedStale true if a previous snapshot was served, false if the empty snapshot was
     */
    void recordAggregationFailure(boolean servedStale);

    void recordHeartbeat();

    void recordMalformedFrame();

    /**
     * Metrics sink that discards everything.
     */
    static RealtimeMetrics noop() {
        return NoopRealtimeMetrics.INSTANCE;
    }
}
