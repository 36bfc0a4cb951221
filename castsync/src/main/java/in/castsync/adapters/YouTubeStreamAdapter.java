package in.castsync.adapters;

import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.YouTubeStream;

import java.util.List;
import java.util.Optional;

public final class YouTubeStreamAdapter implements StreamAdapter {
    public static final String SUBSCRIBER_COUNT = "subscriberCount";
    public static final String SUPER_CHAT = "youtubeSuperChat";

    private final YouTubeStream data;

    public YouTubeStreamAdapter(YouTubeStream data) {
        this.data = data;
    }

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }

    @Override
    public String getId() {
        return data.videoId();
    }

    @Override
    public String getTitle() {
        return data.title();
    }

    @Override
    public String getCategory() {
        String categoryId = data.categoryId();
        return categoryId == null || categoryId.isBlank() ? NO_CATEGORY : categoryId;
    }

    @Override
    public String getThumbnail() {
        return data.thumbnailUrl();
    }

    @Override
    public List<String> getTags() {
        return data.tags();
    }

    @Override
    public boolean hasFeature(String feature) {
        return SUBSCRIBER_COUNT.equals(feature) || SUPER_CHAT.equals(feature);
    }

    @Override
    public Optional<FeatureData> getFeature(String feature) {
        if (SUBSCRIBER_COUNT.equals(feature)) {
            return Optional.of(new FeatureData.Total(data.subscriberCount()));
        }
        if (SUPER_CHAT.equals(feature)) {
            return Optional.of(new FeatureData.Monetary(data.superChatTotal(), "USD"));
        }
        return Optional.empty();
    }

    @Override
    public YouTubeStream toStorage() {
        return data;
    }
}
