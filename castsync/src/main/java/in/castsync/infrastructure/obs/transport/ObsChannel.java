package in.castsync.infrastructure.obs.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Open connection returned by {@link ObsTransport#open}.
 */
public interface ObsChannel {

    int NORMAL_CLOSURE = 1000;

    /**
     * Queue a text frame. Safe to call from multiple threads; frames go out in call order.
     */
    CompletableFuture<Void> sendText(String frame);

    /**
     * Close the connection. Idempotent.
     */
    void close(int statusCode, String reason);
}
