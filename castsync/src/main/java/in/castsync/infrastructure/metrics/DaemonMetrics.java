package in.castsync.infrastructure.metrics;

import in.castsync.domain.stream.StreamState;

import java.time.Duration;

/**
 * Daemon metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Control requests by type and outcome, and their latency
 * - Control connection events (connected, disconnected, auth failures, reconnect attempts)
 * - Detector state
 * - Sessions created by the detector and by the matcher, and matcher splits
 */
public interface DaemonMetrics {

    /**
     * Record a settled control request.
     *
     * @param outcome success, failure, timeout or closed
     */
    void recordRequest(String requestType, String outcome, Duration latency);

    /**
     * @param event connected, disconnected, auth_failed, connect_failed, reconnect_attempt
     */
    void recordConnectionEvent(String event);

    void recordStreamState(StreamState state);

    /**
     * @param source detector or matcher
     */
    void recordSessionCreated(String source);

    void recordSplit();

    DaemonMetrics NOOP = new DaemonMetrics() {
        @Override
        public void recordRequest(String requestType, String outcome, Duration latency) {}

        @Override
        public void recordConnectionEvent(String event) {}

        @Override
        public void recordStreamState(StreamState state) {}

        @Override
        public void recordSessionCreated(String source) {}

        @Override
        public void recordSplit() {}
    };
}
