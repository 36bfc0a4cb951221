package in.castsync.domain.stream;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * Normalized snapshot of one platform's view of a broadcast.
 *
 * Stored platform-tagged: the JSON form carries {@code "platform": "twitch" | "kick" | "youtube"}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "platform")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TwitchStream.class, name = "twitch"),
    @JsonSubTypes.Type(value = KickStream.class, name = "kick"),
    @JsonSubTypes.Type(value = YouTubeStream.class, name = "youtube")
})
public interface PlatformStream {

    Platform platform();

    String title();

    List<String> tags();

    String thumbnailUrl();

    /**
     * When the platform reports the broadcast started.
     */
    Instant startTime();

    /**
     * When the platform reports the broadcast ended, or null while still live.
     */
    Instant endTime();
}
