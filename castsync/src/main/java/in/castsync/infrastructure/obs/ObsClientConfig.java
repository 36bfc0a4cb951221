package in.castsync.infrastructure.obs;

import in.castsync.util.Env;

import java.net.URI;
import java.time.Duration;

/**
 * Control client settings.
 *
 * @param password           shared secret; null when the endpoint has auth disabled
 * @param eventSubscriptions identify bitmask; 64 subscribes to output events
 */
public record ObsClientConfig(
    URI endpoint,
    String password,
    Duration requestTimeout,
    Duration handshakeTimeout,
    int eventSubscriptions
) {
    public static final URI DEFAULT_ENDPOINT = URI.create("ws://localhost:4455");
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
    public static final int SUBSCRIBE_OUTPUTS = 1 << 6;

    public ObsClientConfig {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (handshakeTimeout == null || handshakeTimeout.isZero() || handshakeTimeout.isNegative()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
        if (password != null && password.isEmpty()) {
            password = null;
        }
    }

    public static ObsClientConfig of(URI endpoint, String password) {
        return new ObsClientConfig(endpoint, password, DEFAULT_REQUEST_TIMEOUT, DEFAULT_HANDSHAKE_TIMEOUT,
            SUBSCRIBE_OUTPUTS);
    }

    public ObsClientConfig withRequestTimeout(Duration timeout) {
        return new ObsClientConfig(endpoint, password, timeout, handshakeTimeout, eventSubscriptions);
    }

    public ObsClientConfig withHandshakeTimeout(Duration timeout) {
        return new ObsClientConfig(endpoint, password, requestTimeout, timeout, eventSubscriptions);
    }

    /**
     * OBS_URL, OBS_PASSWORD, OBS_REQUEST_TIMEOUT_MS, OBS_HANDSHAKE_TIMEOUT_MS.
     */
    public static ObsClientConfig fromEnv() {
        return new ObsClientConfig(
            URI.create(Env.get("OBS_URL", DEFAULT_ENDPOINT.toString())),
            Env.get("OBS_PASSWORD", null),
            Duration.ofMillis(Env.getInt("OBS_REQUEST_TIMEOUT_MS", (int) DEFAULT_REQUEST_TIMEOUT.toMillis())),
            Duration.ofMillis(Env.getInt("OBS_HANDSHAKE_TIMEOUT_MS", (int) DEFAULT_HANDSHAKE_TIMEOUT.toMillis())),
            SUBSCRIBE_OUTPUTS
        );
    }

    @Override
    public String toString() {
        return "ObsClientConfig[endpoint=" + endpoint + ", auth=" + (password != null)
            + ", requestTimeout=" + requestTimeout.toMillis() + "ms"
            + ", handshakeTimeout=" + handshakeTimeout.toMillis() + "ms]";
    }
}
