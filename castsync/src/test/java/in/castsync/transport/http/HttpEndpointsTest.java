package in.castsync.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.castsync.application.service.DetectorStatus;
import in.castsync.application.service.ObsStreamDetector;
import in.castsync.domain.stream.Stream;
import in.castsync.domain.stream.StreamState;
import in.castsync.infrastructure.metrics.PrometheusDaemonMetrics;
import in.castsync.infrastructure.metrics.PrometheusMetricsHandler;
import in.castsync.infrastructure.obs.ObsWebSocketClient;
import in.castsync.infrastructure.obs.supervisor.ObsConnectionSupervisor;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * /health and /metrics served by Undertow.
 *
 * Tests:
 * - Health status derivation (healthy / degraded / unhealthy)
 * - Detector details in the health body
 * - Prometheus text export
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HttpEndpointsTest {

    private static final int TEST_PORT = 19091;
    private static final Instant NOW = Instant.parse("2026-03-14T18:30:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ObsWebSocketClient client;
    @Mock
    private ObsStreamDetector detector;
    @Mock
    private ObsConnectionSupervisor supervisor;

    private PrometheusDaemonMetrics metrics;
    private HealthHandler health;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        when(client.getEndpoint()).thenReturn("localhost:4455");
        when(detector.getStatus()).thenReturn(new DetectorStatus(false, StreamState.OFFLINE, null));

        metrics = new PrometheusDaemonMetrics(new CollectorRegistry());
        health = new HealthHandler(client, detector, supervisor, "0.4.0", Clock.fixed(NOW, ZoneOffset.UTC));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/health", health)
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // /health
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void healthyWhileConnectedAndLive() throws Exception {
        when(client.isConnected()).thenReturn(true);
        Stream live = Stream.started("session-1", Instant.parse("2026-03-14T18:00:00Z"));
        when(detector.getStatus()).thenReturn(new DetectorStatus(true, StreamState.LIVE, live));

        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.path("status").asText());
        assertEquals("0.4.0", body.path("version").asText());
        assertEquals(NOW.toString(), body.path("ts").asText());
        assertTrue(body.path("components").path("control").path("connected").asBoolean());
        assertEquals("localhost:4455", body.path("components").path("control").path("endpoint").asText());
        JsonNode det = body.path("components").path("detector");
        assertEquals("live", det.path("state").asText());
        assertTrue(det.path("streaming").asBoolean());
        assertEquals("session-1", det.path("currentStreamId").asText());
        assertEquals("2026-03-14T18:00:00Z", det.path("obsStartTime").asText());
    }

    @Test
    void degradedWhileReconnecting() {
        when(client.isConnected()).thenReturn(false);
        when(supervisor.isGivenUp()).thenReturn(false);

        ObjectNode snapshot = health.snapshot();

        assertEquals("degraded", snapshot.path("status").asText());
        assertEquals("unhealthy", snapshot.path("components").path("control").path("status").asText());
        assertTrue(snapshot.path("components").path("detector").path("currentStreamId").isNull());
        assertEquals(0, snapshot.path("uptimeSeconds").asLong());
    }

    @Test
    void unhealthyOnceSupervisorGivesUp() throws Exception {
        when(client.isConnected()).thenReturn(false);
        when(supervisor.isGivenUp()).thenReturn(true);

        HttpResponse<String> response = get("/health");

        assertEquals(503, response.statusCode());
        assertEquals("unhealthy", MAPPER.readTree(response.body()).path("status").asText());
    }

    @Test
    void degradedWithoutSupervisor() {
        when(client.isConnected()).thenReturn(false);
        HealthHandler unsupervised = new HealthHandler(client, detector, null, "dev", Clock.systemUTC());

        assertEquals("degraded", unsupervised.snapshot().path("status").asText());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // /metrics
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void metricsExportedInPrometheusFormat() throws Exception {
        metrics.recordRequest("GetStreamStatus", "success", Duration.ofMillis(5));
        metrics.recordSessionCreated("detector");

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        String body = response.body();
        assertTrue(body.contains("obs_requests_total{type=\"GetStreamStatus\",outcome=\"success\",} 1.0"), body);
        assertTrue(body.contains("stream_sessions_created_total{source=\"detector\",} 1.0"), body);
        assertTrue(body.contains("stream_detector_state{state=\"offline\",} 1.0"), body);
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        assertEquals(404, get("/nope").statusCode());
    }
}
