package in.castsync.domain.stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Video platforms whose stream metadata is reconciled into sessions.
 */
public enum Platform {
    TWITCH("twitch", "Twitch"),
    KICK("kick", "Kick"),
    YOUTUBE("youtube", "YouTube");

    private final String code;
    private final String displayName;

    Platform(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Wire/storage code ("twitch", "kick", "youtube").
     */
    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static Platform fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (Platform p : values()) {
                if (p.code.equals(normalized)) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + code);
    }

    public static boolean isValid(String code) {
        if (code == null) return false;
        for (Platform p : values()) {
            if (p.code.equals(code)) {
                return true;
            }
        }
        return false;
    }
}
