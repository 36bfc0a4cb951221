package in.castsync.adapters;

import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.TwitchStream;

import java.util.List;
import java.util.Optional;

public final class TwitchStreamAdapter implements StreamAdapter {
    public static final String CHANNEL_POINTS = "twitchChannelPoints";

    private final TwitchStream data;

    public TwitchStreamAdapter(TwitchStream data) {
        this.data = data;
    }

    @Override
    public Platform getPlatform() {
        return Platform.TWITCH;
    }

    @Override
    public String getId() {
        return data.twitchId();
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
        return CHANNEL_POINTS.equals(feature);
    }

    @Override
    public Optional<FeatureData> getFeature(String feature) {
        if (CHANNEL_POINTS.equals(feature)) {
            return Optional.of(new FeatureData.Current(data.channelPoints()));
        }
        return Optional.empty();
    }

    @Override
    public TwitchStream toStorage() {
        return data;
    }
}
