package in.castsync.domain.stream;

import java.time.Instant;
import java.util.List;

/**
 * Twitch stream snapshot.
 */
public record TwitchStream(
    String twitchId,
    String username,
    String title,
    String categoryId,
    List<String> tags,
    boolean mature,
    String language,
    String thumbnailUrl,   // null when Twitch has not generated one yet
    long channelPoints,
    Instant startTime,
    Instant endTime        // null while live
) implements PlatformStream {

    public TwitchStream {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @Override
    public Platform platform() {
        return Platform.TWITCH;
    }
}
