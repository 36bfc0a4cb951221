package in.castsync.infrastructure.obs.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ObsTransport} over {@code java.net.http.WebSocket}.
 */
public final class JdkWebSocketTransport implements ObsTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    public static final String SUBPROTOCOL = "obswebsocket.json";

    private final HttpClient httpClient;

    public JdkWebSocketTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    public JdkWebSocketTransport() {
        this(Duration.ofSeconds(10));
    }

    @Override
    public CompletableFuture<ObsChannel> open(URI endpoint, Listener listener) {
        return httpClient.newWebSocketBuilder()
            .subprotocols(SUBPROTOCOL)
            .buildAsync(endpoint, new ListenerBridge(listener))
            .thenApply(JdkChannel::new);
    }

    private static final class ListenerBridge implements WebSocket.Listener {
        private final Listener listener;
        private final StringBuilder buf = new StringBuilder();
        private final AtomicBoolean terminated = new AtomicBoolean(false);

        ListenerBridge(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String frame = buf.toString();
                buf.setLength(0);
                listener.onText(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (terminated.compareAndSet(false, true)) {
                listener.onClosed(statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            if (terminated.compareAndSet(false, true)) {
                listener.onError(error);
            }
        }
    }

    private static final class JdkChannel implements ObsChannel {
        private final WebSocket ws;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Object sendLock = new Object();
        // java.net.http allows one outstanding send at a time
        private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

        JdkChannel(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public CompletableFuture<Void> sendText(String frame) {
            synchronized (sendLock) {
                CompletableFuture<Void> send = lastSend
                    .handle((ignored, previousFailure) -> null)
                    .thenCompose(ignored -> ws.sendText(frame, true))
                    .thenApply(w -> null);
                lastSend = send;
                return send;
            }
        }

        @Override
        public void close(int statusCode, String reason) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            ws.sendClose(statusCode, reason == null ? "" : reason)
                .whenComplete((w, error) -> {
                    if (error != null) {
                        log.debug("[OBS TRANSPORT] Close handshake failed: {}", error.getMessage());
                    }
                    ws.abort();
                });
        }
    }
}
