package in.castsync.domain.stream;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Kick stream snapshot.
 */
public record KickStream(
    String kickId,
    String username,
    String title,
    String categorySlug,
    List<String> tags,
    String language,
    String thumbnailUrl,
    BigDecimal totalTipsUsd,
    Instant startTime,
    Instant endTime
) implements PlatformStream {

    public KickStream {
        tags = tags == null ? List.of() : List.copyOf(tags);
        totalTipsUsd = totalTipsUsd == null ? BigDecimal.ZERO : totalTipsUsd;
    }

    @Override
    public Platform platform() {
        return Platform.KICK;
    }
}
