package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Control client for the local broadcasting application.
 *
 * Features:
 * - Hello / identify handshake with optional challenge-response authentication
 * - Request/response correlation by request id, one expiry timer per request
 * - Listener registration per event: connected, disconnected, error, stream state change, raw frame
 *
 * Listeners are invoked synchronously on the frame-processing thread, one frame at a time,
 * in arrival order. A listener must not block; an exception thrown by one listener is logged
 * and does not stop delivery to the others.
 *
 * Usage:
 * <pre>
 * ObsWebSocketClient client = new JdkObsWebSocketClient(ObsClientConfig.fromEnv());
 * client.onStreamStateChanged(event -> log.info("state {}", event.outputState()));
 * client.connect().join();
 * ObsStreamStatus status = client.getStreamStatus().join();
 * </pre>
 */
public interface ObsWebSocketClient extends AutoCloseable {

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Open the socket and complete the handshake.
     *
     * Completes after the server acknowledges identify. Fails with {@link ObsAuthenticationException}
     * when the server rejects authentication, or {@link ObsConnectionException} on transport error
     * or handshake timeout. While a connection is already open or opening, returns the same future.
     */
    CompletableFuture<Void> connect();

    /**
     * Close the socket. Pending requests fail with {@link ObsConnectionException}; listeners
     * registered with {@link #onDisconnected} run if the connection had been established. Idempotent.
     */
    CompletableFuture<Void> disconnect();

    boolean isConnected();

    String getEndpoint();

    // ═══════════════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    void onConnected(Runnable listener);

    void onDisconnected(Runnable listener);

    void onError(Consumer<Throwable> listener);

    void onStreamStateChanged(Consumer<ObsStreamStateChanged> listener);

    /**
     * Every decoded inbound frame, before op-specific handling.
     */
    void onMessage(Consumer<JsonNode> listener);

    // ═══════════════════════════════════════════════════════════════════════
    // REQUESTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Send a request with a generated id ({@code <requestType>-<uuid>}).
     */
    CompletableFuture<ObsResponse> send(String requestType, JsonNode requestData);

    /**
     * Send a request with a caller-supplied id.
     *
     * The future fails with {@link ObsConnectionException} if not connected or the connection
     * closes first, {@link ObsRequestTimeoutException} if no response arrives in time, and
     * {@link IllegalArgumentException} if a request with the same id is still pending.
     * A response with {@code result=false} still completes normally.
     */
    CompletableFuture<ObsResponse> send(String requestType, String requestId, JsonNode requestData);

    /**
     * {@code GetStreamStatus}. Fails with {@link ObsRequestFailedException} if the server reports failure.
     */
    CompletableFuture<ObsStreamStatus> getStreamStatus();

    /**
     * Disconnect and release the timer thread.
     */
    @Override
    void close();
}
