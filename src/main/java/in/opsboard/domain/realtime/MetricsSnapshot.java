package in.opsboard.domain.realtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregated operational summary for one tenant, served as the initial payload on connect.
 */
public record MetricsSnapshot(
    @JsonProperty("business_id")
    String tenantId,

    @JsonProperty("orders")
    OrderStats orders,

    @JsonProperty("revenue")
    RevenueStats revenue,

    @JsonProperty("tables")
    TableStats tables,

    @JsonProperty("staff")
    StaffStats staff,

    @JsonProperty("inventory")
    InventoryStats inventory,

    @JsonProperty("computed_at")
    Instant computedAt
) {
    /**
     * Zeroed snapshot returned when no aggregate has ever been computed for the tenant.
     */
    public static MetricsSnapshot empty(String tenantId) {
        return new MetricsSnapshot(
            tenantId,
            new OrderStats(0, 0, 0),
            new RevenueStats(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
            new TableStats(0, 0, 0, 0),
            new StaffStats(0, 0),
            new InventoryStats(0, 0),
            Instant.EPOCH
        );
    }

    public boolean isEmpty() {
        return Instant.EPOCH.equals(computedAt);
    }

    public record OrderStats(
        @JsonProperty("active") int active,
        @JsonProperty("completed_today") int completedToday,
        @JsonProperty("pending_kitchen") int pendingKitchen
    ) {}

    public record RevenueStats(
        @JsonProperty("today") BigDecimal today,
        @JsonProperty("this_hour") BigDecimal thisHour,
        @JsonProperty("avg_order_value") BigDecimal avgOrderValue
    ) {}

    public record TableStats(
        @JsonProperty("total") int total,
        @JsonProperty("available") int available,
        @JsonProperty("occupied") int occupied,
        @JsonProperty("reserved") int reserved
    ) {}

    public record StaffStats(
        @JsonProperty("clocked_in") int clockedIn,
        @JsonProperty("on_break") int onBreak
    ) {}

    public record InventoryStats(
        @JsonProperty("low_stock_items") int lowStockItems,
        @JsonProperty("out_of_stock_items") int outOfStockItems
    ) {}
}
