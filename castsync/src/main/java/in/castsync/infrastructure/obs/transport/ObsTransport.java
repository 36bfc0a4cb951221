package in.castsync.infrastructure.obs.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Message-oriented socket underneath the control client.
 *
 * Implementations deliver listener callbacks one at a time, in arrival order, and report
 * termination exactly once through either {@link Listener#onClosed} or {@link Listener#onError}.
 */
public interface ObsTransport {

    /**
     * Open a connection. The returned future fails if the socket cannot be opened.
     */
    CompletableFuture<ObsChannel> open(URI endpoint, Listener listener);

    interface Listener {

        /**
         * A complete text frame (fragments already reassembled).
         */
        void onText(String frame);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }
}
