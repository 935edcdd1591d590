package in.opsboard.domain.realtime;

import java.util.Objects;

/**
 * Broadcast grouping: (tenant, channel[, subKey]).
 *
 * subKey is the station for kitchen displays and the location for table views; null means the
 * unqualified channel partition.
 */
public record PartitionKey(String tenantId, ChannelKind channel, String subKey) {
    public PartitionKey {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        Objects.requireNonNull(channel, "channel");
        if (subKey != null && subKey.isBlank()) {
            subKey = null;
        }
    }

    public static PartitionKey of(String tenantId, ChannelKind channel) {
        return new PartitionKey(tenantId, channel, null);
    }

    public static PartitionKey dashboard(String tenantId) {
        return of(tenantId, ChannelKind.DASHBOARD);
    }

    public static PartitionKey kitchenDisplay(String tenantId, String station) {
        return new PartitionKey(tenantId, ChannelKind.KITCHEN_DISPLAY, station);
    }

    public static PartitionKey tableView(String tenantId, String locationId) {
        return new PartitionKey(tenantId, ChannelKind.TABLE_VIEW, locationId);
    }

    public boolean isQualified() {
        return subKey != null;
    }

    @Override
    public String toString() {
        return subKey == null
            ? tenantId + "/" + channel.wireName()
            : tenantId + "/" + channel.wireName() + "/" + subKey;
    }
}
