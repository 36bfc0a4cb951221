package in.castsync.domain.stream;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * YouTube live broadcast snapshot.
 */
public record YouTubeStream(
    String videoId,
    String channelTitle,
    String title,
    String categoryId,
    List<String> tags,
    String privacyStatus,
    String thumbnailUrl,
    long subscriberCount,
    BigDecimal superChatTotal,
    Instant startTime,
    Instant endTime
) implements PlatformStream {

    public YouTubeStream {
        tags = tags == null ? List.of() : List.copyOf(tags);
        privacyStatus = privacyStatus == null ? "public" : privacyStatus;
        superChatTotal = superChatTotal == null ? BigDecimal.ZERO : superChatTotal;
    }

    @Override
    public Platform platform() {
        return Platform.YOUTUBE;
    }
}
