package in.castsync.infrastructure.obs.supervisor;

import in.castsync.infrastructure.metrics.DaemonMetrics;
import in.castsync.infrastructure.obs.ObsAuthenticationException;
import in.castsync.infrastructure.obs.ObsWebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the control connection up.
 *
 * Connects on {@link #start()}, and again after every disconnect, waiting between failed
 * attempts as dictated by the {@link ReconnectionPolicy}. A rejected password stops
 * retrying for good: the same credentials would be rejected again.
 */
public final class ObsConnectionSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObsConnectionSupervisor.class);

    private final ObsWebSocketClient client;
    private final ReconnectionPolicy policy;
    private final DaemonMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private boolean started = false;
    private boolean stopped = false;
    private ScheduledFuture<?> pendingAttempt;

    public ObsConnectionSupervisor(ObsWebSocketClient client, ReconnectionPolicy policy, DaemonMetrics metrics) {
        this.client = client;
        this.policy = policy;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "obs-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        client.onDisconnected(this::handleDisconnected);
        log.info("[SUPERVISOR] Starting control connection supervision for {}", client.getEndpoint());
        scheduleAttempt(Duration.ZERO);
    }

    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
        scheduler.shutdownNow();
        log.info("[SUPERVISOR] Stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * True once retries have been abandoned, after an auth rejection or the attempt limit.
     */
    public boolean isGivenUp() {
        return policy.isExhausted();
    }

    private void handleDisconnected() {
        synchronized (this) {
            if (stopped) {
                return;
            }
        }
        Duration delay = policy.getNextDelay();
        log.warn("[SUPERVISOR] Control connection lost, reconnecting in {}ms", delay.toMillis());
        scheduleAttempt(delay);
    }

    private synchronized void scheduleAttempt(Duration delay) {
        if (stopped) {
            return;
        }
        if (pendingAttempt != null && !pendingAttempt.isDone()) {
            return;
        }
        pendingAttempt = scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attempt() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            pendingAttempt = null;
        }
        if (policy.getAttemptCount() > 0) {
            metrics.recordConnectionEvent("reconnect_attempt");
        }
        client.connect().whenComplete((v, error) -> {
            if (error == null) {
                if (policy.getAttemptCount() > 0) {
                    log.info("[SUPERVISOR] Reconnected after {} failed attempt(s)", policy.getAttemptCount());
                }
                policy.recordSuccess();
                return;
            }
            handleFailure(error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
        });
    }

    private void handleFailure(Throwable cause) {
        if (cause instanceof ObsAuthenticationException) {
            policy.recordFatal();
            log.error("[SUPERVISOR] ❌ Authentication rejected, not retrying: {}", cause.getMessage());
            return;
        }
        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        if (!policy.shouldRetry()) {
            log.error("[SUPERVISOR] ❌ Giving up after {} failed attempt(s): {}",
                policy.getAttemptCount(), cause.getMessage());
            return;
        }
        log.warn("[SUPERVISOR] Connect attempt {} failed ({}), retrying in {}ms",
            policy.getAttemptCount(), cause.getMessage(), delay.toMillis());
        scheduleAttempt(delay);
    }
}
