package in.castsync.adapters;

import java.math.BigDecimal;

/**
 * Value of a platform-specific feature exposed through {@link StreamAdapter#getFeature(String)}.
 */
public interface FeatureData {

    /** Running balance, e.g. channel points. */
    record Current(long current) implements FeatureData {}

    /** Absolute count, e.g. subscribers. */
    record Total(long total) implements FeatureData {}

    /** Money amount, e.g. tips or super chats. */
    record Monetary(BigDecimal value, String currency) implements FeatureData {}
}
