package in.opsboard.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.opsboard.config.RealtimeConfig;
import in.opsboard.infrastructure.metrics.PrometheusRealtimeMetrics;
import in.opsboard.infrastructure.persistence.JdbcSnapshotAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * OpsBoard realtime server entry point.
 *
 * - Environment-driven configuration, validated before anything starts
 * - PostgreSQL snapshot aggregation over a HikariCP pool
 * - Prometheus metrics at /metrics
 * - WebSocket channels: dashboard, kitchen display, table view
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== OpsBoard Realtime Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        RealtimeConfig config = RealtimeConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED: {}", e.getMessage());
            System.exit(1);
        }

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // HTTP + WebSocket server
        // ═══════════════════════════════════════════════════════════════
        RealtimeServer server = new RealtimeServer(
            config, new JdbcSnapshotAggregator(dataSource), metrics, Clock.systemUTC());
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            dataSource.close();
            log.info("=== OpsBoard Realtime Stopped ===");
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource(RealtimeConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        // Lazy: the server starts even if the database is still coming up.
        hikari.setInitializationFailTimeout(-1);
        hikari.setPoolName("opsboard-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
