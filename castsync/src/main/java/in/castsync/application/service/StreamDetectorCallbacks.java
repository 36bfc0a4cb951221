package in.castsync.application.service;

import in.castsync.domain.stream.Stream;

import java.time.Instant;

/**
 * Lifecycle notifications from {@link ObsStreamDetector}. All methods default to no-ops.
 *
 * Called on the control client's frame thread; implementations must not block.
 */
public interface StreamDetectorCallbacks {

    StreamDetectorCallbacks NONE = new StreamDetectorCallbacks() {};

    default void onStreamStarting() {}

    /**
     * A new session was created and persisted.
     */
    default void onStreamStart(Stream stream) {}

    default void onStreamStopping() {}

    /**
     * The session was finalized with {@code endTime}.
     */
    default void onStreamStop(Stream stream, Instant endTime) {}

    default void onStreamReconnecting() {}

    default void onStreamReconnected() {}
}
