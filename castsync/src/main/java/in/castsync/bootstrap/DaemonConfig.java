package in.castsync.bootstrap;

import in.castsync.application.service.StreamMatcher;
import in.castsync.infrastructure.obs.ObsClientConfig;
import in.castsync.infrastructure.obs.supervisor.ReconnectionPolicy;
import in.castsync.util.Env;

import java.time.Duration;
import java.util.Locale;

/**
 * Daemon settings, read once at startup.
 */
public record DaemonConfig(
    ObsClientConfig obs,
    boolean httpEnabled,
    int httpPort,
    double matchThreshold,
    StoreType store,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts
) {

    public enum StoreType {
        MEMORY, POSTGRES;

        static StoreType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("STREAM_STORE must be memory or postgres, got: " + value, e);
            }
        }
    }

    public DaemonConfig {
        if (obs == null) {
            throw new IllegalArgumentException("obs config is required");
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("HTTP_PORT out of range: " + httpPort);
        }
        if (!(matchThreshold > 0.0 && matchThreshold <= 1.0)) {
            throw new IllegalArgumentException("MATCH_OVERLAP_THRESHOLD must be in (0, 1], got " + matchThreshold);
        }
        if (dbPoolSize <= 0) {
            throw new IllegalArgumentException("DB_POOL_SIZE must be positive");
        }
    }

    /**
     * Environment variables, with system properties as fallback.
     */
    public static DaemonConfig fromEnv() {
        return new DaemonConfig(
            ObsClientConfig.fromEnv(),
            Env.getBool("HTTP_ENABLED", true),
            Env.getInt("HTTP_PORT", 9091),
            Env.getDouble("MATCH_OVERLAP_THRESHOLD", StreamMatcher.DEFAULT_THRESHOLD),
            StoreType.parse(Env.get("STREAM_STORE", "memory")),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/castsync"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 5),
            Duration.ofMillis(Env.getInt("OBS_RECONNECT_INITIAL_MS", 1000)),
            Duration.ofMillis(Env.getInt("OBS_RECONNECT_MAX_MS", 60000)),
            Env.getInt("OBS_RECONNECT_MAX_ATTEMPTS", ReconnectionPolicy.UNLIMITED)
        );
    }

    public ReconnectionPolicy reconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(2.0)
            .maxAttempts(reconnectMaxAttempts)
            .build();
    }

    @Override
    public String toString() {
        return "DaemonConfig[" + obs + ", http=" + (httpEnabled ? httpPort : "off")
            + ", threshold=" + matchThreshold + ", store=" + store
            + (store == StoreType.POSTGRES ? ", db=" + dbUrl + " user=" + dbUser + " pool=" + dbPoolSize : "")
            + ", reconnect=" + reconnectInitialDelay.toMillis() + ".." + reconnectMaxDelay.toMillis() + "ms"
            + " x" + (reconnectMaxAttempts == ReconnectionPolicy.UNLIMITED ? "∞" : reconnectMaxAttempts) + "]";
    }
}
