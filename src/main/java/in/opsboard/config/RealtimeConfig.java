package in.opsboard.config;

import in.opsboard.realtime.ConnectionSession;
import in.opsboard.realtime.MetricsCache;
import in.opsboard.util.Env;

import java.time.Duration;

/**
 * Runtime configuration of the realtime server.
 *
 * Loaded once at startup by {@link #fromEnv()} and checked by the startup validator.
 */
public record RealtimeConfig(
    int port,
    Duration idleTimeout,          // silence before a heartbeat is sent
    Duration metricsCacheTtl,      // snapshot freshness window
    int maxPendingFrames,          // per-connection outbound frames in flight
    String wsToken,                // empty = admit every handshake
    boolean kdsStationRouting,     // narrow kds_update to the matching station
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    boolean productionMode
) {
    public static final String DEFAULT_DB_URL = "jdbc:postgresql://localhost:5432/opsboard";
    public static final String DEFAULT_DB_USER = "postgres";
    public static final String DEFAULT_DB_PASS = "postgres";

    /**
     * Defaults used for every variable left unset.
     */
    public static RealtimeConfig defaults() {
        return new RealtimeConfig(
            8095,
            ConnectionSession.DEFAULT_IDLE_TIMEOUT,
            MetricsCache.DEFAULT_TTL,
            256,
            "",
            false,
            DEFAULT_DB_URL,
            DEFAULT_DB_USER,
            DEFAULT_DB_PASS,
            10,
            false
        );
    }

    public static RealtimeConfig fromEnv() {
        RealtimeConfig d = defaults();
        return new RealtimeConfig(
            Env.getInt("PORT", d.port()),
            Duration.ofMillis(Env.getLong("WS_IDLE_TIMEOUT_MS", d.idleTimeout().toMillis())),
            Duration.ofMillis(Env.getLong("METRICS_CACHE_TTL_MS", d.metricsCacheTtl().toMillis())),
            Env.getInt("WS_MAX_PENDING_FRAMES", d.maxPendingFrames()),
            Env.get("WS_TOKEN", d.wsToken()),
            Env.getBool("KDS_STATION_ROUTING", d.kdsStationRouting()),
            Env.get("DB_URL", d.dbUrl()),
            Env.get("DB_USER", d.dbUser()),
            Env.get("DB_PASS", d.dbPass()),
            Env.getInt("DB_POOL_SIZE", d.dbPoolSize()),
            Env.getBool("PRODUCTION_MODE", d.productionMode())
        );
    }

    public boolean requiresToken() {
        return wsToken != null && !wsToken.isBlank();
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return port > 0 && port <= 65535
            && idleTimeout != null && !idleTimeout.isNegative() && !idleTimeout.isZero()
            && metricsCacheTtl != null && !metricsCacheTtl.isNegative() && !metricsCacheTtl.isZero()
            && maxPendingFrames > 0
            && dbUrl != null && dbUrl.startsWith("jdbc:")
            && dbPoolSize > 0;
    }
}
