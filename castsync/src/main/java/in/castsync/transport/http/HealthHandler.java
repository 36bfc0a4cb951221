package in.castsync.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.castsync.application.service.DetectorStatus;
import in.castsync.application.service.ObsStreamDetector;
import in.castsync.domain.stream.Stream;
import in.castsync.infrastructure.obs.ObsWebSocketClient;
import in.castsync.infrastructure.obs.supervisor.ObsConnectionSupervisor;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * GET /health.
 *
 * healthy: control connection up. degraded: down, reconnect in progress.
 * unhealthy: down and the supervisor has given up (503).
 */
public final class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObsWebSocketClient client;
    private final ObsStreamDetector detector;
    private final ObsConnectionSupervisor supervisor;
    private final String version;
    private final Clock clock;
    private final Instant startedAt;

    public HealthHandler(ObsWebSocketClient client, ObsStreamDetector detector, ObsConnectionSupervisor supervisor,
                         String version, Clock clock) {
        this.client = client;
        this.detector = detector;
        this.supervisor = supervisor;
        this.version = version;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        ObjectNode health = snapshot();
        exchange.setStatusCode("unhealthy".equals(health.path("status").asText()) ? 503 : 200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(health));
        log.debug("[HEALTH] Served status {}", health.path("status").asText());
    }

    ObjectNode snapshot() {
        boolean connected = client.isConnected();
        String status;
        if (connected) {
            status = "healthy";
        } else if (supervisor != null && supervisor.isGivenUp()) {
            status = "unhealthy";
        } else {
            status = "degraded";
        }

        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", status);
        health.put("version", version);
        health.put("ts", clock.instant().toString());
        health.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());

        ObjectNode components = health.putObject("components");
        ObjectNode control = components.putObject("control");
        control.put("status", connected ? "healthy" : "unhealthy");
        control.put("endpoint", client.getEndpoint());
        control.put("connected", connected);

        DetectorStatus detectorStatus = detector.getStatus();
        ObjectNode det = components.putObject("detector");
        det.put("state", detectorStatus.state().name().toLowerCase());
        det.put("streaming", detectorStatus.streaming());
        Stream current = detectorStatus.currentStream();
        if (current != null) {
            det.put("currentStreamId", current.commonId());
            det.put("obsStartTime", current.obsStartTime().toString());
        } else {
            det.putNull("currentStreamId");
        }
        return health;
    }
}
