package in.opsboard.infrastructure.metrics;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.domain.realtime.EventKind;

import java.time.Duration;

final class NoopRealtimeMetrics implements RealtimeMetrics {
    static final NoopRealtimeMetrics INSTANCE = new NoopRealtimeMetrics();

    private NoopRealtimeMetrics() {}

    @Override
    public void connectionRegistered(ChannelKind channel) {}

    @Override
    public void connectionDeregistered(ChannelKind channel) {}

    @Override
    public void recordBroadcast(EventKind kind, int delivered, int failed, Duration latency) {}

    @Override
    public void recordCacheHit() {}

    @Override
    public void recordCacheMiss() {}

    @Override
    public void recordAggregationFailure(boolean servedStale) {}

    @Override
    public void recordHeartbeat() {}

    @Override
    public void recordMalformedFrame() {}
}
