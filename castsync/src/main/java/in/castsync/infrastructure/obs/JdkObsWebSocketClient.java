package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import in.castsync.infrastructure.metrics.DaemonMetrics;
import in.castsync.infrastructure.obs.transport.JdkWebSocketTransport;
import in.castsync.infrastructure.obs.transport.ObsChannel;
import in.castsync.infrastructure.obs.transport.ObsTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link ObsWebSocketClient} over an {@link ObsTransport}, by default {@link JdkWebSocketTransport}.
 *
 * Each connect attempt gets its own {@link Session}. Callbacks from a session that has
 * already been torn down are ignored, so a late close from an old socket never disturbs
 * a newer connection.
 */
public final class JdkObsWebSocketClient implements ObsWebSocketClient {
    private static final Logger log = LoggerFactory.getLogger(JdkObsWebSocketClient.class);

    static final int SUPPORTED_RPC_VERSION = 1;
    static final int AUTHENTICATION_FAILED_CLOSE_CODE = 4009;
    static final String GET_STREAM_STATUS = "GetStreamStatus";

    private final ObsClientConfig config;
    private final ObsTransport transport;
    private final ObsFrameCodec codec;
    private final DaemonMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final PendingRequestRegistry pending;
    private final String endpointLabel;

    private final List<Runnable> connectedListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> disconnectedListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ObsStreamStateChanged>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<JsonNode>> messageListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private Session session;  // guarded by lock

    public JdkObsWebSocketClient(ObsClientConfig config, ObsTransport transport, DaemonMetrics metrics) {
        this.config = config;
        this.transport = transport;
        this.codec = new ObsFrameCodec();
        this.metrics = metrics;
        this.endpointLabel = maskEndpoint(config.endpoint());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "obs-client-timers");
            t.setDaemon(true);
            return t;
        });
        this.pending = new PendingRequestRegistry(endpointLabel, config.requestTimeout(), scheduler);
    }

    public JdkObsWebSocketClient(ObsClientConfig config) {
        this(config, new JdkWebSocketTransport(config.handshakeTimeout()), DaemonMetrics.NOOP);
    }

    /**
     * One socket, from open to close.
     */
    private final class Session implements ObsTransport.Listener {
        final CompletableFuture<Void> ready = new CompletableFuture<>();
        final AtomicBoolean closed = new AtomicBoolean(false);
        final CompletableFuture<ObsChannel> channel = new CompletableFuture<>();
        volatile ScheduledFuture<?> handshakeTimer;
        volatile boolean helloSeen;
        volatile boolean identified;

        CompletableFuture<Void> sendText(String frame) {
            return channel.thenCompose(ch -> ch.sendText(frame));
        }

        @Override
        public void onText(String frame) {
            handleFrame(this, frame);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            handleRemoteClose(this, statusCode, reason);
        }

        @Override
        public void onError(Throwable error) {
            log.error("[OBS CLIENT] Transport error on {}: {}", endpointLabel, error.getMessage());
            terminate(this, new ObsConnectionException(endpointLabel, "Transport error: " + error.getMessage(), error),
                error);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> connect() {
        Session s;
        synchronized (lock) {
            if (session != null && !session.closed.get()) {
                log.debug("[OBS CLIENT] connect() while already {}", session.identified ? "connected" : "connecting");
                return session.ready;
            }
            s = new Session();
            session = s;
        }

        log.info("[OBS CLIENT] Connecting to {} (auth={})", endpointLabel, config.password() != null);
        s.handshakeTimer = scheduler.schedule(() -> handshakeTimedOut(s),
            config.handshakeTimeout().toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture<ObsChannel> opened;
        try {
            opened = transport.open(config.endpoint(), s);
        } catch (RuntimeException e) {
            opened = CompletableFuture.failedFuture(e);
        }
        opened.whenComplete((ch, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("[OBS CLIENT] Failed to open {}: {}", endpointLabel, cause.getMessage());
                s.channel.completeExceptionally(cause);
                terminate(s, new ObsConnectionException(endpointLabel, "Failed to open socket: " + cause.getMessage(),
                    cause), null);
            } else {
                // a disconnect that raced the open closes the channel through this completion
                s.channel.complete(ch);
            }
        });
        return s.ready;
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        Session s;
        synchronized (lock) {
            s = session;
        }
        if (s == null || s.closed.get()) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("[OBS CLIENT] Disconnecting from {}", endpointLabel);
        terminate(s, new ObsConnectionException(endpointLabel, "Disconnected by client"), null);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isConnected() {
        synchronized (lock) {
            return session != null && session.identified && !session.closed.get();
        }
    }

    @Override
    public String getEndpoint() {
        return endpointLabel;
    }

    @Override
    public void close() {
        disconnect();
        scheduler.shutdownNow();
    }

    private void handshakeTimedOut(Session s) {
        if (s.identified || s.closed.get()) {
            return;
        }
        log.error("[OBS CLIENT] Handshake with {} timed out after {}ms",
            endpointLabel, config.handshakeTimeout().toMillis());
        terminate(s, new ObsConnectionException(endpointLabel,
            "Handshake timed out after " + config.handshakeTimeout().toMillis() + "ms"), null);
    }

    private void handleRemoteClose(Session s, int statusCode, String reason) {
        RuntimeException cause;
        if (!s.identified && statusCode == AUTHENTICATION_FAILED_CLOSE_CODE) {
            log.error("[OBS CLIENT] Authentication rejected by {}: {}", endpointLabel, reason);
            cause = new ObsAuthenticationException(endpointLabel, "Authentication failed"
                + (reason == null || reason.isEmpty() ? "" : ": " + reason));
        } else {
            log.warn("[OBS CLIENT] Connection to {} closed ({} {})", endpointLabel, statusCode, reason);
            cause = new ObsConnectionException(endpointLabel, "Connection closed (" + statusCode
                + (reason == null || reason.isEmpty() ? "" : " " + reason) + ")");
        }
        terminate(s, cause, null);
    }

    /**
     * Tear a session down exactly once.
     *
     * @param cause          failure handed to a connect still in progress
     * @param transportError non-null when the socket failed; forwarded to error listeners
     */
    private void terminate(Session s, RuntimeException cause, Throwable transportError) {
        if (!s.closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (lock) {
            if (session == s) {
                session = null;
            }
        }
        ScheduledFuture<?> timer = s.handshakeTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        s.channel.thenAccept(ch -> ch.close(ObsChannel.NORMAL_CLOSURE, "closing"));

        int rejected = pending.failAll(new ObsConnectionException(endpointLabel, "Connection closed"));
        if (rejected > 0) {
            log.warn("[OBS CLIENT] Rejected {} pending request(s) on close", rejected);
        }

        if (!s.ready.isDone()) {
            metrics.recordConnectionEvent(cause instanceof ObsAuthenticationException ? "auth_failed" : "connect_failed");
            s.ready.completeExceptionally(cause);
        }
        if (transportError != null) {
            emitError(transportError);
        }
        if (s.identified) {
            metrics.recordConnectionEvent("disconnected");
            log.info("[OBS CLIENT] Disconnected from {}", endpointLabel);
            emit("disconnected", disconnectedListeners);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND FRAMES
    // ═══════════════════════════════════════════════════════════════════════

    private void handleFrame(Session s, String text) {
        if (s.closed.get()) {
            return;
        }
        JsonNode frame;
        try {
            frame = codec.decode(text);
        } catch (ObsProtocolException e) {
            log.warn("[OBS CLIENT] Dropping malformed frame: {}", e.getMessage());
            return;
        }

        emit("message", messageListeners, frame);

        ObsOpCode op = codec.opOf(frame);
        if (op == null) {
            log.debug("[OBS CLIENT] Ignoring frame with unknown op {}", frame.path("op").asInt());
            return;
        }
        try {
            switch (op) {
                case HELLO -> handleHello(s, frame);
                case IDENTIFIED -> handleIdentified(s);
                case EVENT -> handleEvent(frame);
                case REQUEST_RESPONSE -> handleResponse(frame);
                default -> log.warn("[OBS CLIENT] Unexpected client-bound op {} from server", op);
            }
        } catch (ObsProtocolException e) {
            log.warn("[OBS CLIENT] Dropping {} frame: {}", op, e.getMessage());
        }
    }

    private void handleHello(Session s, JsonNode frame) {
        if (s.helloSeen) {
            throw new ObsProtocolException("Duplicate Hello");
        }
        ObsFrameCodec.Hello hello = codec.decodeHello(frame);
        s.helloSeen = true;
        log.info("[OBS CLIENT] Hello from {}: obs-websocket {} rpc v{}{}", endpointLabel,
            hello.obsWebSocketVersion(), hello.rpcVersion(), hello.authenticationRequired() ? " (auth required)" : "");

        String authentication = null;
        if (hello.authenticationRequired()) {
            if (config.password() == null) {
                log.warn("[OBS CLIENT] {} requires authentication but no password is configured", endpointLabel);
            } else {
                authentication = ObsAuthenticator.authResponse(config.password(), hello.salt(), hello.challenge());
            }
        }

        int rpcVersion = Math.min(hello.rpcVersion(), SUPPORTED_RPC_VERSION);
        s.sendText(codec.encodeIdentify(rpcVersion, authentication, config.eventSubscriptions()))
            .whenComplete((v, error) -> {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    terminate(s, new ObsConnectionException(endpointLabel, "Failed to send identify", cause), cause);
                }
            });
    }

    private void handleIdentified(Session s) {
        if (s.identified) {
            throw new ObsProtocolException("Duplicate Identified");
        }
        s.identified = true;
        ScheduledFuture<?> timer = s.handshakeTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        log.info("[OBS CLIENT] ✅ Connected to {}", endpointLabel);
        metrics.recordConnectionEvent("connected");
        emit("connected", connectedListeners);
        s.ready.complete(null);
    }

    private void handleEvent(JsonNode frame) {
        String eventType = codec.eventTypeOf(frame);
        if (!ObsFrameCodec.STREAM_STATE_CHANGED.equals(eventType)) {
            log.trace("[OBS CLIENT] Ignoring event {}", eventType);
            return;
        }
        ObsStreamStateChanged event = codec.decodeStreamStateChanged(frame);
        log.info("[OBS CLIENT] Stream state changed: {} (active={})", event.outputState(), event.outputActive());
        emit("streamStateChanged", stateListeners, event);
    }

    private void handleResponse(JsonNode frame) {
        ObsResponse response = codec.decodeResponse(frame);
        if (!pending.complete(response)) {
            log.debug("[OBS CLIENT] No pending request for response {} ({})",
                response.requestId(), response.requestType());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // REQUESTS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<ObsResponse> send(String requestType, JsonNode requestData) {
        return send(requestType, requestType + "-" + UUID.randomUUID(), requestData);
    }

    @Override
    public CompletableFuture<ObsResponse> send(String requestType, String requestId, JsonNode requestData) {
        Session s;
        synchronized (lock) {
            s = session;
        }
        if (s == null || !s.identified || s.closed.get()) {
            return CompletableFuture.failedFuture(new ObsConnectionException(endpointLabel, "Not connected"));
        }

        long startNanos = System.nanoTime();
        CompletableFuture<ObsResponse> future;
        try {
            future = pending.register(requestId, requestType);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        future.whenComplete((response, error) -> metrics.recordRequest(requestType, outcomeOf(response, error),
            Duration.ofNanos(System.nanoTime() - startNanos)));

        log.debug("[OBS CLIENT] → {} ({})", requestType, requestId);
        s.sendText(codec.encodeRequest(requestType, requestId, requestData))
            .whenComplete((v, error) -> {
                if (error != null) {
                    pending.fail(requestId, new ObsConnectionException(endpointLabel,
                        "Failed to send " + requestType, unwrap(error)));
                }
            });
        return future;
    }

    @Override
    public CompletableFuture<ObsStreamStatus> getStreamStatus() {
        return send(GET_STREAM_STATUS, "status-" + UUID.randomUUID(), null)
            .thenApply(response -> {
                if (!response.result()) {
                    throw new ObsRequestFailedException(endpointLabel, GET_STREAM_STATUS,
                        response.code(), response.comment());
                }
                JsonNode data = response.responseData() != null ? response.responseData() : MissingNode.getInstance();
                return ObsStreamStatus.fromResponseData(data);
            });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LISTENERS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void onConnected(Runnable listener) {
        connectedListeners.add(listener);
    }

    @Override
    public void onDisconnected(Runnable listener) {
        disconnectedListeners.add(listener);
    }

    @Override
    public void onError(Consumer<Throwable> listener) {
        errorListeners.add(listener);
    }

    @Override
    public void onStreamStateChanged(Consumer<ObsStreamStateChanged> listener) {
        stateListeners.add(listener);
    }

    @Override
    public void onMessage(Consumer<JsonNode> listener) {
        messageListeners.add(listener);
    }

    private void emit(String event, List<Runnable> listeners) {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("[OBS CLIENT] {} listener failed: {}", event, e.getMessage(), e);
            }
        }
    }

    private <T> void emit(String event, List<Consumer<T>> listeners, T value) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                log.error("[OBS CLIENT] {} listener failed: {}", event, e.getMessage(), e);
            }
        }
    }

    private void emitError(Throwable error) {
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (RuntimeException e) {
                log.warn("[OBS CLIENT] error listener failed: {}", e.getMessage(), e);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private static String outcomeOf(ObsResponse response, Throwable error) {
        if (error == null) {
            return response.result() ? "success" : "failure";
        }
        Throwable cause = unwrap(error);
        if (cause instanceof ObsRequestTimeoutException) {
            return "timeout";
        }
        if (cause instanceof ObsConnectionException) {
            return "closed";
        }
        return "failure";
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * host:port only; drops user info, path and query, which may carry credentials.
     */
    static String maskEndpoint(URI endpoint) {
        String host = endpoint.getHost() != null ? endpoint.getHost() : endpoint.toString();
        return endpoint.getPort() > 0 ? host + ":" + endpoint.getPort() : host;
    }
}
