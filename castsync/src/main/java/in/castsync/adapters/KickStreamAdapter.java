package in.castsync.adapters;

import in.castsync.domain.stream.KickStream;
import in.castsync.domain.stream.Platform;

import java.util.List;
import java.util.Optional;

public final class KickStreamAdapter implements StreamAdapter {
    public static final String TIPS = "kickTips";

    private final KickStream data;

    public KickStreamAdapter(KickStream data) {
        this.data = data;
    }

    @Override
    public Platform getPlatform() {
        return Platform.KICK;
    }

    @Override
    public String getId() {
        return data.kickId();
    }

    @Override
    public String getTitle() {
        return data.title();
    }

    @Override
    public String getCategory() {
        String slug = data.categorySlug();
        return slug == null || slug.isBlank() ? NO_CATEGORY : slug;
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
        return TIPS.equals(feature);
    }

    @Override
    public Optional<FeatureData> getFeature(String feature) {
        if (TIPS.equals(feature)) {
            return Optional.of(new FeatureData.Monetary(data.totalTipsUsd(), "USD"));
        }
        return Optional.empty();
    }

    @Override
    public KickStream toStorage() {
        return data;
    }
}
