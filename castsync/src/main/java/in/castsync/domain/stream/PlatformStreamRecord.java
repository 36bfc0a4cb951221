package in.castsync.domain.stream;

import java.time.Instant;
import java.util.UUID;

/**
 * One platform's snapshot attached to a canonical {@link Stream}.
 *
 * Immutable. Moving a snapshot to another session is a remove followed by a create,
 * never a mutation of the owner.
 */
public record PlatformStreamRecord(
    String id,
    String commonId,
    Platform platform,
    PlatformStream data,
    Instant createdAt
) {

    public static PlatformStreamRecord create(String commonId, PlatformStream data) {
        return new PlatformStreamRecord(
            UUID.randomUUID().toString(),
            commonId,
            data.platform(),
            data,
            Instant.now()
        );
    }
}
