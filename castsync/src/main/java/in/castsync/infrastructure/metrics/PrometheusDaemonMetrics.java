package in.castsync.infrastructure.metrics;

import in.castsync.domain.stream.StreamState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of {@link DaemonMetrics}, scraped at /metrics.
 *
 * Key Metrics:
 * - obs_requests_total{type, outcome}
 * - obs_request_latency_seconds{type}
 * - obs_connection_events_total{event}
 * - stream_detector_state{state} - 1 for the current state, 0 otherwise
 * - stream_sessions_created_total{source}
 * - stream_splits_total
 */
public class PrometheusDaemonMetrics implements DaemonMetrics {

    private final CollectorRegistry registry;

    private final Counter requestCounter;
    private final Histogram requestLatency;
    private final Counter connectionEventCounter;
    private final Gauge detectorState;
    private final Counter sessionCounter;
    private final Counter splitCounter;

    public PrometheusDaemonMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusDaemonMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.requestCounter = Counter.build()
            .name("obs_requests_total")
            .help("Control requests by type and outcome")
            .labelNames("type", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("obs_request_latency_seconds")
            .help("Control request round-trip latency in seconds")
            .labelNames("type")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 30.0)
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("obs_connection_events_total")
            .help("Control connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.detectorState = Gauge.build()
            .name("stream_detector_state")
            .help("Current detector state (1 = active state)")
            .labelNames("state")
            .register(registry);

        this.sessionCounter = Counter.build()
            .name("stream_sessions_created_total")
            .help("Sessions created, by creating component")
            .labelNames("source")
            .register(registry);

        this.splitCounter = Counter.build()
            .name("stream_splits_total")
            .help("Platform records detached into new sessions")
            .register(registry);

        recordStreamState(StreamState.OFFLINE);
    }

    @Override
    public void recordRequest(String requestType, String outcome, Duration latency) {
        requestCounter.labels(requestType, outcome).inc();
        requestLatency.labels(requestType).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordConnectionEvent(String event) {
        connectionEventCounter.labels(event).inc();
    }

    @Override
    public void recordStreamState(StreamState state) {
        for (StreamState s : StreamState.values()) {
            detectorState.labels(s.name().toLowerCase()).set(s == state ? 1 : 0);
        }
    }

    @Override
    public void recordSessionCreated(String source) {
        sessionCounter.labels(source).inc();
    }

    @Override
    public void recordSplit() {
        splitCounter.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
