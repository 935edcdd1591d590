package in.opsboard.bootstrap;

import in.opsboard.config.RealtimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Called from App.main() before anything is started. Throws IllegalStateException if the
 * configuration is invalid and the server refuses to start.
 *
 * Production mode adds hard gates:
 * - WS_TOKEN must be set (no anonymous handshakes)
 * - DB_PASS must not be the development default
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RealtimeConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (!config.isValid()) {
            throw new IllegalStateException(
                "INVALID CONFIG: " + describe(config) + "\n" +
                "Check PORT, WS_IDLE_TIMEOUT_MS, METRICS_CACHE_TTL_MS, WS_MAX_PENDING_FRAMES, DB_URL and DB_POOL_SIZE."
            );
        }
        log.info("Production mode: {}", config.productionMode());

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(RealtimeConfig config) {
        if (!config.requiresToken()) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires WS_TOKEN to be set\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Set WS_TOKEN to the shared handshake token\n" +
                "  2. Set PRODUCTION_MODE=false for local development"
            );
        }
        log.info("✓ WebSocket handshake token configured");

        if (RealtimeConfig.DEFAULT_DB_PASS.equals(config.dbPass())) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE must not use the default DB_PASS\n" +
                "System refuses to start."
            );
        }
        log.info("✓ Database credentials configured");
    }

    private static void warnNonProductionMode(RealtimeConfig config) {
        if (!config.requiresToken()) {
            log.warn("⚠️ WS_TOKEN not set: every WebSocket handshake is admitted");
        }
        if (RealtimeConfig.DEFAULT_DB_PASS.equals(config.dbPass())) {
            log.warn("⚠️ Using default database credentials");
        }
    }

    static String describe(RealtimeConfig config) {
        return "port=" + config.port()
            + ", idleTimeout=" + config.idleTimeout()
            + ", metricsCacheTtl=" + config.metricsCacheTtl()
            + ", maxPendingFrames=" + config.maxPendingFrames()
            + ", dbUrl=" + config.dbUrl()
            + ", dbPoolSize=" + config.dbPoolSize();
    }

    private StartupConfigValidator() {}
}
