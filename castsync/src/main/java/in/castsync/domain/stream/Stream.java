package in.castsync.domain.stream;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Canonical streaming session.
 *
 * A session spans one local recording interval ({@code obsStartTime}..{@code obsEndTime}) and
 * zero or more platform-reported intervals. {@code platforms} is only populated when loaded
 * through {@code StreamService.getStreamWithPlatforms}; other lookups return it empty.
 */
public record Stream(
    String commonId,
    Instant obsStartTime,
    Instant obsEndTime,     // null = still live, or never observed locally
    Instant createdAt,
    List<PlatformStreamRecord> platforms
) {

    public Stream {
        if (commonId == null || commonId.isBlank()) {
            throw new IllegalArgumentException("commonId is required");
        }
        if (obsStartTime == null) {
            throw new IllegalArgumentException("obsStartTime is required");
        }
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public static Stream started(String commonId, Instant obsStartTime) {
        return new Stream(commonId, obsStartTime, null, Instant.now(), List.of());
    }

    public Stream withObsEndTime(Instant endTime) {
        return new Stream(commonId, obsStartTime, endTime, createdAt, platforms);
    }

    public Stream withPlatforms(List<PlatformStreamRecord> records) {
        return new Stream(commonId, obsStartTime, obsEndTime, createdAt, records);
    }

    public boolean isLive() {
        return obsEndTime == null;
    }

    /**
     * End of the session for overlap purposes: the recorded end, or {@code now} while open.
     */
    public Instant effectiveEnd(Instant now) {
        return obsEndTime != null ? obsEndTime : now;
    }

    public Optional<PlatformStreamRecord> platform(Platform platform) {
        return platforms.stream()
            .filter(r -> r.platform() == platform)
            .findFirst();
    }
}
