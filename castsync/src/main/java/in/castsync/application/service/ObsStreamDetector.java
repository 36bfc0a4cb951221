package in.castsync.application.service;

import in.castsync.application.port.output.StreamService;
import in.castsync.domain.stream.Stream;
import in.castsync.domain.stream.StreamState;
import in.castsync.infrastructure.metrics.DaemonMetrics;
import in.castsync.infrastructure.obs.ObsStreamStateChanged;
import in.castsync.infrastructure.obs.ObsStreamStatus;
import in.castsync.infrastructure.obs.ObsWebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * ObsStreamDetector - turns output state changes from the local recorder into sessions.
 *
 * Transitions:
 * <pre>
 * starting                      → STARTING
 * started / reconnected         → LIVE          (new session unless already LIVE)
 * stopping                      → STOPPING
 * stopped                       → OFFLINE       (current session gets its end time)
 * reconnecting                  → RECONNECTING
 * paused / resumed / unknown    → unchanged
 * </pre>
 *
 * On every connect the current output status is queried once, so a daemon restarted
 * mid-broadcast picks the running session up with a start time backdated by the output
 * duration. A bare disconnect resets to OFFLINE without writing an end time.
 *
 * Handlers run on the control client's frame thread, one event at a time. A store failure
 * during a live transition propagates as {@link StreamPersistenceException} to the client,
 * which logs it and keeps dispatching; the state is left as it was before the event.
 *
 * A failed backfill write completes on a store thread and clears the session by
 * compare-and-set, never taking the monitor a frame-thread handler may hold while it waits
 * on that same store.
 */
public final class ObsStreamDetector {
    private static final Logger log = LoggerFactory.getLogger(ObsStreamDetector.class);

    private final ObsWebSocketClient client;
    private final StreamService streamService;
    private final StreamDetectorCallbacks callbacks;
    private final DaemonMetrics metrics;
    private final Clock clock;
    private final Supplier<String> idSupplier;

    private StreamState state = StreamState.OFFLINE;
    private final AtomicReference<Stream> currentStream = new AtomicReference<>();

    public ObsStreamDetector(ObsWebSocketClient client, StreamService streamService) {
        this(client, streamService, StreamDetectorCallbacks.NONE);
    }

    public ObsStreamDetector(ObsWebSocketClient client, StreamService streamService,
                             StreamDetectorCallbacks callbacks) {
        this(client, streamService, callbacks, DaemonMetrics.NOOP, Clock.systemUTC(),
            () -> UUID.randomUUID().toString());
    }

    public ObsStreamDetector(
            ObsWebSocketClient client,
            StreamService streamService,
            StreamDetectorCallbacks callbacks,
            DaemonMetrics metrics,
            Clock clock,
            Supplier<String> idSupplier) {
        this.client = client;
        this.streamService = streamService;
        this.callbacks = callbacks;
        this.metrics = metrics;
        this.clock = clock;
        this.idSupplier = idSupplier;

        client.onConnected(this::handleConnected);
        client.onStreamStateChanged(this::handleStreamStateChanged);
        client.onError(error -> log.error("[DETECTOR] Control connection error: {}", error.getMessage()));
        client.onDisconnected(this::handleDisconnected);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PUBLIC API
    // ═══════════════════════════════════════════════════════════════════════

    public CompletableFuture<Void> connect() {
        return client.connect();
    }

    public CompletableFuture<Void> disconnect() {
        return client.disconnect();
    }

    public synchronized DetectorStatus getStatus() {
        return new DetectorStatus(state == StreamState.LIVE, state, currentStream.get());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    private void handleConnected() {
        // must not join here: the status response arrives on this same frame thread
        client.getStreamStatus()
            .thenAccept(this::applyInitialStatus)
            .exceptionally(error -> {
                log.error("[DETECTOR] Failed to get initial stream status: {}", error.getMessage());
                return null;
            });
    }

    synchronized void applyInitialStatus(ObsStreamStatus status) {
        if (!status.active()) {
            log.info("[DETECTOR] Output inactive on connect");
            currentStream.set(null);
            setState(StreamState.OFFLINE);
            return;
        }
        if (status.reconnecting()) {
            log.info("[DETECTOR] Output reconnecting on connect");
            setState(StreamState.RECONNECTING);
            return;
        }

        setState(StreamState.LIVE);
        if (currentStream.get() != null) {
            return;
        }
        Instant estimatedStart = clock.instant().minus(Duration.ofMillis(status.durationMs()));
        Stream stream = Stream.started(idSupplier.get(), estimatedStart);
        currentStream.set(stream);
        log.info("[DETECTOR] Output already live ({}), backfilling session {} from {}",
            status.timecode(), stream.commonId(), estimatedStart);

        streamService.createStream(stream.commonId(), estimatedStart).whenComplete((v, error) -> {
            if (error != null) {
                log.error("[DETECTOR] Failed to create session {} from status: {}",
                    stream.commonId(), error.getMessage());
                currentStream.compareAndSet(stream, null);
                return;
            }
            metrics.recordSessionCreated("detector");
            notifyCallback("onStreamStart", () -> callbacks.onStreamStart(stream));
        });
    }

    private synchronized void handleDisconnected() {
        Stream lost = currentStream.getAndSet(null);
        if (lost != null) {
            log.warn("[DETECTOR] Control connection lost during session {}; end time not recorded",
                lost.commonId());
        }
        setState(StreamState.OFFLINE);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // OUTPUT STATE
    // ═══════════════════════════════════════════════════════════════════════

    synchronized void handleStreamStateChanged(ObsStreamStateChanged event) {
        log.debug("[DETECTOR] {} in state {}", event.outputState(), state);
        switch (event.outputState()) {
            case STARTING -> {
                setState(StreamState.STARTING);
                notifyCallback("onStreamStarting", callbacks::onStreamStarting);
            }
            case STARTED, RECONNECTED -> handleLive();
            case STOPPING -> {
                setState(StreamState.STOPPING);
                notifyCallback("onStreamStopping", callbacks::onStreamStopping);
            }
            case STOPPED -> handleStopped();
            case RECONNECTING -> {
                setState(StreamState.RECONNECTING);
                notifyCallback("onStreamReconnecting", callbacks::onStreamReconnecting);
            }
            default -> log.debug("[DETECTOR] Ignoring output state {}", event.outputState());
        }
    }

    private void handleLive() {
        if (state == StreamState.LIVE) {
            return;
        }
        StreamState prior = state;
        Instant startTime = clock.instant();
        String commonId = idSupplier.get();

        StreamPersistenceException.await(streamService.createStream(commonId, startTime), "createStream", commonId);

        Stream stream = Stream.started(commonId, startTime);
        currentStream.set(stream);
        setState(StreamState.LIVE);
        metrics.recordSessionCreated("detector");
        log.info("[DETECTOR] 🔴 Session {} started at {}", commonId, startTime);

        notifyCallback("onStreamStart", () -> callbacks.onStreamStart(stream));
        if (prior == StreamState.RECONNECTING) {
            notifyCallback("onStreamReconnected", callbacks::onStreamReconnected);
        }
    }

    private void handleStopped() {
        Stream stream = currentStream.get();
        if (stream != null) {
            Instant endTime = clock.instant();
            StreamPersistenceException.await(streamService.updateStreamEnd(stream.commonId(), endTime),
                "updateStreamEnd", stream.commonId());
            Stream finished = stream.withObsEndTime(endTime);
            currentStream.compareAndSet(stream, null);
            log.info("[DETECTOR] ⏹ Session {} ended at {}", stream.commonId(), endTime);
            notifyCallback("onStreamStop", () -> callbacks.onStreamStop(finished, endTime));
        }
        setState(StreamState.OFFLINE);
    }

    private void setState(StreamState next) {
        if (state != next) {
            log.info("[DETECTOR] {} → {}", state, next);
            state = next;
            metrics.recordStreamState(next);
        }
    }

    private void notifyCallback(String name, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("[DETECTOR] Callback {} failed: {}", name, e.getMessage(), e);
        }
    }
}
