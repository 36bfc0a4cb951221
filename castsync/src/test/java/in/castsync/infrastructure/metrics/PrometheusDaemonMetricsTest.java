package in.castsync.infrastructure.metrics;

import in.castsync.domain.stream.StreamState;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusDaemonMetricsTest {

    private CollectorRegistry registry;
    private PrometheusDaemonMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusDaemonMetrics(registry);
    }

    private double sample(String name, String[] labels, String[] values) {
        Double value = registry.getSampleValue(name, labels, values);
        return value == null ? 0.0 : value;
    }

    @Test
    void requestsCountedByTypeAndOutcome() {
        metrics.recordRequest("GetStreamStatus", "success", Duration.ofMillis(12));
        metrics.recordRequest("GetStreamStatus", "success", Duration.ofMillis(8));
        metrics.recordRequest("GetStreamStatus", "timeout", Duration.ofSeconds(30));

        String[] labels = {"type", "outcome"};
        assertEquals(2.0, sample("obs_requests_total", labels, new String[]{"GetStreamStatus", "success"}));
        assertEquals(1.0, sample("obs_requests_total", labels, new String[]{"GetStreamStatus", "timeout"}));
        assertEquals(3.0, sample("obs_request_latency_seconds_count",
            new String[]{"type"}, new String[]{"GetStreamStatus"}));
    }

    @Test
    void detectorStateIsOneHot() {
        String[] labels = {"state"};
        assertEquals(1.0, sample("stream_detector_state", labels, new String[]{"offline"}));

        metrics.recordStreamState(StreamState.LIVE);

        assertEquals(1.0, sample("stream_detector_state", labels, new String[]{"live"}));
        assertEquals(0.0, sample("stream_detector_state", labels, new String[]{"offline"}));
        assertEquals(0.0, sample("stream_detector_state", labels, new String[]{"reconnecting"}));
    }

    @Test
    void sessionsConnectionsAndSplits() {
        metrics.recordSessionCreated("detector");
        metrics.recordSessionCreated("matcher");
        metrics.recordSessionCreated("matcher");
        metrics.recordConnectionEvent("auth_failed");
        metrics.recordSplit();

        assertEquals(1.0, sample("stream_sessions_created_total", new String[]{"source"}, new String[]{"detector"}));
        assertEquals(2.0, sample("stream_sessions_created_total", new String[]{"source"}, new String[]{"matcher"}));
        assertEquals(1.0, sample("obs_connection_events_total", new String[]{"event"}, new String[]{"auth_failed"}));
        assertEquals(1.0, sample("stream_splits_total", new String[]{}, new String[]{}));
    }
}
