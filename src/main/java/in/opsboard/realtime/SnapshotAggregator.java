package in.opsboard.realtime;

import in.opsboard.domain.realtime.MetricsSnapshot;

/**
 * Computes a tenant's aggregated metrics from the backing store.
 * Must be safe to call concurrently for different tenants.
 */
@FunctionalInterface
public interface SnapshotAggregator {

    /**
     * @throws AggregationException if the store cannot be queried
     */
    MetricsSnapshot computeSnapshot(String tenantId);
}
