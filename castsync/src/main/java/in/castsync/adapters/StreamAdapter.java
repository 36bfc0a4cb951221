package in.castsync.adapters;

import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.PlatformStream;

import java.util.List;
import java.util.Optional;

/**
 * Uniform read view over a platform stream snapshot.
 */
public interface StreamAdapter {

    String NO_CATEGORY = "No Category";

    Platform getPlatform();

    /**
     * Platform-native identifier (Twitch stream id, Kick id, YouTube video id).
     */
    String getId();

    String getTitle();

    /**
     * Category identifier, or {@value #NO_CATEGORY} when the platform reported none.
     */
    String getCategory();

    String getThumbnail();

    List<String> getTags();

    boolean hasFeature(String feature);

    Optional<FeatureData> getFeature(String feature);

    /**
     * The exact snapshot this adapter wraps.
     */
    PlatformStream toStorage();
}
