package in.opsboard.infrastructure.persistence;

import in.opsboard.domain.realtime.MetricsSnapshot;
import in.opsboard.realtime.AggregationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcSnapshotAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:34:56Z");

    @Mock private DataSource dataSource;
    @Mock private Connection connection;

    private JdbcSnapshotAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new JdbcSnapshotAggregator(dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ResultSet stubQuery(String sql) throws SQLException {
        PreparedStatement stmt = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.prepareStatement(sql)).thenReturn(stmt);
        when(stmt.executeQuery()).thenReturn(rs);
        return rs;
    }

    @Test
    void testMapsEverySection() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);

        ResultSet kds = stubQuery(JdbcSnapshotAggregator.KDS_SQL);
        when(kds.next()).thenReturn(true);
        when(kds.getInt("active")).thenReturn(7);
        when(kds.getInt("pending_kitchen")).thenReturn(3);

        ResultSet sales = stubQuery(JdbcSnapshotAggregator.DAILY_SALES_SQL);
        when(sales.next()).thenReturn(true);
        when(sales.getInt("completed_today")).thenReturn(41);
        when(sales.getBigDecimal("revenue_today")).thenReturn(new BigDecimal("1520.50"));
        when(sales.getBigDecimal("avg_order_value")).thenReturn(new BigDecimal("37.09"));

        ResultSet hourly = stubQuery(JdbcSnapshotAggregator.HOURLY_REVENUE_SQL);
        when(hourly.next()).thenReturn(true);
        when(hourly.getBigDecimal("this_hour")).thenReturn(new BigDecimal("210.00"));

        ResultSet tables = stubQuery(JdbcSnapshotAggregator.TABLES_SQL);
        when(tables.next()).thenReturn(true);
        when(tables.getInt("tables_total")).thenReturn(20);
        when(tables.getInt("available")).thenReturn(11);
        when(tables.getInt("occupied")).thenReturn(7);
        when(tables.getInt("reserved")).thenReturn(2);

        ResultSet staff = stubQuery(JdbcSnapshotAggregator.STAFF_SQL);
        when(staff.next()).thenReturn(true);
        when(staff.getInt("clocked_in")).thenReturn(9);
        when(staff.getInt("on_break")).thenReturn(1);

        ResultSet inventory = stubQuery(JdbcSnapshotAggregator.INVENTORY_SQL);
        when(inventory.next()).thenReturn(true);
        when(inventory.getInt("low_stock")).thenReturn(4);
        when(inventory.getInt("out_of_stock")).thenReturn(1);

        MetricsSnapshot snapshot = aggregator.computeSnapshot("b-1");

        assertEquals("b-1", snapshot.tenantId());
        assertEquals(NOW, snapshot.computedAt());
        assertEquals(new MetricsSnapshot.OrderStats(7, 41, 3), snapshot.orders());
        assertEquals(new BigDecimal("1520.50"), snapshot.revenue().today());
        assertEquals(new BigDecimal("210.00"), snapshot.revenue().thisHour());
        assertEquals(new BigDecimal("37.09"), snapshot.revenue().avgOrderValue());
        assertEquals(new MetricsSnapshot.TableStats(20, 11, 7, 2), snapshot.tables());
        assertEquals(new MetricsSnapshot.StaffStats(9, 1), snapshot.staff());
        assertEquals(new MetricsSnapshot.InventoryStats(4, 1), snapshot.inventory());
        assertFalse(snapshot.isEmpty());

        verify(connection).close();
    }

    @Test
    void testMissingRowsAndNullsBecomeZero() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        PreparedStatement stmt = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.prepareStatement(anyString())).thenReturn(stmt);
        when(stmt.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        MetricsSnapshot snapshot = aggregator.computeSnapshot("b-2");

        assertEquals(0, snapshot.orders().completedToday());
        assertEquals(BigDecimal.ZERO, snapshot.revenue().today());
        assertEquals(BigDecimal.ZERO, snapshot.revenue().thisHour());
        assertEquals(0, snapshot.tables().total());
        verify(stmt, times(6)).setString(1, "b-2");
    }

    @Test
    void testSqlExceptionBecomesAggregationException() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        AggregationException e = assertThrows(AggregationException.class, () -> aggregator.computeSnapshot("b-3"));

        assertEquals("b-3", e.getTenantId());
        assertTrue(e.getMessage().contains("connection refused"));
        assertInstanceOf(SQLException.class, e.getCause());
    }

    @Test
    void testQueryFailureClosesConnection() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("relation \"kds_orders\" does not exist"));

        assertThrows(AggregationException.class, () -> aggregator.computeSnapshot("b-4"));
        verify(connection).close();
    }
}
