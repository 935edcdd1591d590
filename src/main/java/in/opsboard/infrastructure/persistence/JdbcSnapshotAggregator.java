package in.opsboard.infrastructure.persistence;

import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.domain.realtime.MetricsSnapshot.InventoryStats;
import in.opsboard.domain.realtime.MetricsSnapshot.OrderStats;
import in.opsboard.domain.realtime.MetricsSnapshot.RevenueStats;
import in.opsboard.domain.realtime.MetricsSnapshot.StaffStats;
import in.opsboard.domain.realtime.MetricsSnapshot.TableStats;
import in.opsboard.realtime.AggregationException;
import in.opsboard.realtime.SnapshotAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Computes a tenant's {@link MetricsSnapshot} straight from the operational tables.
 *
 * One connection per snapshot, one query per section:
 * - kds_orders: active (pending or preparing) and pending tickets
 * - daily_sales_summary: today's order count, revenue and average order value
 * - orders: revenue since the top of the hour
 * - tables: status breakdown
 * - time_clock: open shifts and open breaks
 * - inventory_items: items at or below their minimum stock, and items at zero
 */
public final class JdbcSnapshotAggregator implements SnapshotAggregator {
    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotAggregator.class);

    static final String KDS_SQL = """
        SELECT
            COUNT(*) FILTER (WHERE status IN ('pending', 'preparing')) AS active,
            COUNT(*) FILTER (WHERE status = 'pending') AS pending_kitchen
        FROM kds_orders
        WHERE business_id = CAST(? AS uuid)
        """;

    static final String DAILY_SALES_SQL = """
        SELECT
            total_orders AS completed_today,
            total_revenue AS revenue_today,
            avg_order_value
        FROM daily_sales_summary
        WHERE business_id = CAST(? AS uuid)
          AND date = CURRENT_DATE
        """;

    static final String HOURLY_REVENUE_SQL = """
        SELECT COALESCE(SUM(total_amount), 0) AS this_hour
        FROM orders
        WHERE business_id = CAST(? AS uuid)
          AND created_at >= date_trunc('hour', NOW())
          AND status <> 'cancelled'
        """;

    static final String TABLES_SQL = """
        SELECT
            COUNT(*) AS tables_total,
            COUNT(*) FILTER (WHERE status = 'available') AS available,
            COUNT(*) FILTER (WHERE status = 'occupied') AS occupied,
            COUNT(*) FILTER (WHERE status = 'reserved') AS reserved
        FROM tables
        WHERE business_id = CAST(? AS uuid)
        """;

    static final String STAFF_SQL = """
        SELECT
            COUNT(*) AS clocked_in,
            COUNT(*) FILTER (WHERE break_start IS NOT NULL AND break_end IS NULL) AS on_break
        FROM time_clock
        WHERE business_id = CAST(? AS uuid)
          AND clock_out IS NULL
        """;

    static final String INVENTORY_SQL = """
        SELECT
            COUNT(*) FILTER (WHERE current_stock <= min_stock) AS low_stock,
            COUNT(*) FILTER (WHERE current_stock <= 0) AS out_of_stock
        FROM inventory_items
        WHERE business_id = CAST(? AS uuid)
        """;

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcSnapshotAggregator(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public JdbcSnapshotAggregator(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    @Override
    public MetricsSnapshot computeSnapshot(String tenantId) {
        long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection()) {
            OrderStats orders;
            RevenueStats revenue;

            try (PreparedStatement stmt = prepare(conn, KDS_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                int active = 0;
                int pending = 0;
                if (rs.next()) {
                    active = rs.getInt("active");
                    pending = rs.getInt("pending_kitchen");
                }
                orders = new OrderStats(active, 0, pending);
            }

            BigDecimal today = BigDecimal.ZERO;
            BigDecimal avgOrderValue = BigDecimal.ZERO;
            try (PreparedStatement stmt = prepare(conn, DAILY_SALES_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    orders = new OrderStats(orders.active(), rs.getInt("completed_today"), orders.pendingKitchen());
                    today = orZero(rs.getBigDecimal("revenue_today"));
                    avgOrderValue = orZero(rs.getBigDecimal("avg_order_value"));
                }
            }

            BigDecimal thisHour = BigDecimal.ZERO;
            try (PreparedStatement stmt = prepare(conn, HOURLY_REVENUE_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    thisHour = orZero(rs.getBigDecimal("this_hour"));
                }
            }
            revenue = new RevenueStats(today, thisHour, avgOrderValue);

            TableStats tables = new TableStats(0, 0, 0, 0);
            try (PreparedStatement stmt = prepare(conn, TABLES_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    tables = new TableStats(
                        rs.getInt("tables_total"),
                        rs.getInt("available"),
                        rs.getInt("occupied"),
                        rs.getInt("reserved"));
                }
            }

            StaffStats staff = new StaffStats(0, 0);
            try (PreparedStatement stmt = prepare(conn, STAFF_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    staff = new StaffStats(rs.getInt("clocked_in"), rs.getInt("on_break"));
                }
            }

            InventoryStats inventory = new InventoryStats(0, 0);
            try (PreparedStatement stmt = prepare(conn, INVENTORY_SQL, tenantId);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    inventory = new InventoryStats(rs.getInt("low_stock"), rs.getInt("out_of_stock"));
                }
            }

            log.debug("[AGGREGATE] snapshot for {} computed in {} ms",
                tenantId, (System.nanoTime() - start) / 1_000_000);
            return new MetricsSnapshot(tenantId, orders, revenue, tables, staff, inventory, clock.instant());

        } catch (SQLException e) {
            throw new AggregationException(tenantId, "snapshot query failed: " + e.getMessage(), e);
        }
    }

    private static PreparedStatement prepare(Connection conn, String sql, String tenantId) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setString(1, tenantId);
        return stmt;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
