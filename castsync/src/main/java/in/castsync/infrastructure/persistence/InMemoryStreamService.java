package in.castsync.infrastructure.persistence;

import in.castsync.application.port.output.StreamService;
import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.PlatformStreamRecord;
import in.castsync.domain.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Thread-safe in-process {@link StreamService}.
 *
 * Each session's row and record list are only modified inside {@code compute} on that
 * session's map entry, so writes to one commonId are serialized and writes to different
 * ones are independent. Futures are returned already completed.
 */
public final class InMemoryStreamService implements StreamService {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamService.class);

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    private record Entry(Stream stream, List<PlatformStreamRecord> records) {}

    // ═══════════════════════════════════════════════════════════════════════
    // SESSIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> createStream(String commonId, Instant obsStartTime) {
        return run(() -> {
            Stream stream = Stream.started(commonId, obsStartTime);
            if (sessions.putIfAbsent(commonId, new Entry(stream, List.of())) != null) {
                throw new IllegalStateException("Stream already exists: " + commonId);
            }
            log.debug("[STREAM STORE] Created stream {} at {}", commonId, obsStartTime);
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<Stream>> getStream(String commonId) {
        return run(() -> Optional.ofNullable(sessions.get(commonId)).map(Entry::stream));
    }

    @Override
    public CompletableFuture<Stream> getOrCreateStream(String commonId, Instant obsStartTime) {
        return run(() -> sessions.computeIfAbsent(commonId,
            id -> new Entry(Stream.started(id, obsStartTime), List.of())).stream());
    }

    @Override
    public CompletableFuture<Void> updateStreamEnd(String commonId, Instant obsEndTime) {
        return run(() -> {
            update(commonId, entry -> new Entry(entry.stream().withObsEndTime(obsEndTime), entry.records()));
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteStream(String commonId) {
        return run(() -> {
            Entry removed = sessions.remove(commonId);
            if (removed != null) {
                log.debug("[STREAM STORE] Deleted stream {} ({} record(s))", commonId, removed.records().size());
            }
            return null;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PLATFORM RECORDS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<PlatformStreamRecord> createPlatformStream(String commonId, PlatformStream platformStream) {
        return run(() -> {
            PlatformStreamRecord record = PlatformStreamRecord.create(commonId, platformStream);
            update(commonId, entry -> {
                boolean taken = entry.records().stream().anyMatch(r -> r.platform() == record.platform());
                if (taken) {
                    throw new IllegalStateException(
                        "Stream " + commonId + " already has a " + record.platform().displayName() + " record");
                }
                List<PlatformStreamRecord> records = new ArrayList<>(entry.records());
                records.add(record);
                return new Entry(entry.stream(), List.copyOf(records));
            });
            return record;
        });
    }

    @Override
    public CompletableFuture<List<PlatformStreamRecord>> getPlatformStreams(String commonId) {
        return run(() -> {
            Entry entry = sessions.get(commonId);
            return entry == null ? List.<PlatformStreamRecord>of() : entry.records();
        });
    }

    @Override
    public CompletableFuture<Void> removePlatformFromStream(String commonId, Platform platform) {
        return run(() -> {
            update(commonId, entry -> {
                List<PlatformStreamRecord> records = new ArrayList<>(entry.records());
                records.removeIf(r -> r.platform() == platform);
                return new Entry(entry.stream(), List.copyOf(records));
            });
            return null;
        });
    }

    @Override
    public CompletableFuture<Stream> getStreamWithPlatforms(String commonId) {
        return run(() -> {
            Entry entry = sessions.get(commonId);
            if (entry == null) {
                throw new NoSuchElementException("Stream not found: " + commonId);
            }
            return entry.stream().withPlatforms(entry.records());
        });
    }

    public int size() {
        return sessions.size();
    }

    private void update(String commonId, UnaryOperator<Entry> change) {
        Entry updated = sessions.computeIfPresent(commonId, (id, entry) -> change.apply(entry));
        if (updated == null) {
            throw new NoSuchElementException("Stream not found: " + commonId);
        }
    }

    private static <T> CompletableFuture<T> run(Supplier<T> body) {
        try {
            return CompletableFuture.completedFuture(body.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
