package in.castsync.application.port.output;

import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.PlatformStreamRecord;
import in.castsync.domain.stream.Stream;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence boundary for canonical sessions and their platform records.
 *
 * Implemented by an external store. Every call is asynchronous and may complete
 * exceptionally; callers do not retry. Implementations must be safe for concurrent use
 * and serialize writes that target the same {@code commonId}.
 */
public interface StreamService {

    // ═══════════════════════════════════════════════════════════════════════
    // SESSIONS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Create a session. {@code commonId} is generated by the caller.
     */
    CompletableFuture<Void> createStream(String commonId, Instant obsStartTime);

    CompletableFuture<Optional<Stream>> getStream(String commonId);

    CompletableFuture<Stream> getOrCreateStream(String commonId, Instant obsStartTime);

    CompletableFuture<Void> updateStreamEnd(String commonId, Instant obsEndTime);

    /**
     * Delete a session together with any platform records it still owns.
     */
    CompletableFuture<Void> deleteStream(String commonId);

    // ═══════════════════════════════════════════════════════════════════════
    // PLATFORM RECORDS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Attach a platform snapshot to a session.
     * Fails if the session already holds a record for the same platform.
     */
    CompletableFuture<PlatformStreamRecord> createPlatformStream(String commonId, PlatformStream platformStream);

    /**
     * Records attached to a session, in attachment order.
     */
    CompletableFuture<List<PlatformStreamRecord>> getPlatformStreams(String commonId);

    CompletableFuture<Void> removePlatformFromStream(String commonId, Platform platform);

    /**
     * Session with {@link Stream#platforms()} populated.
     * Fails with {@link java.util.NoSuchElementException} if the session does not exist.
     */
    CompletableFuture<Stream> getStreamWithPlatforms(String commonId);
}
