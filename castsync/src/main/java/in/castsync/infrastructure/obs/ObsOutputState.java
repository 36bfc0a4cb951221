package in.castsync.infrastructure.obs;

/**
 * Output states reported by {@code StreamStateChanged} events.
 */
public enum ObsOutputState {
    UNKNOWN("OBS_WEBSOCKET_OUTPUT_UNKNOWN"),
    STARTING("OBS_WEBSOCKET_OUTPUT_STARTING"),
    STARTED("OBS_WEBSOCKET_OUTPUT_STARTED"),
    STOPPING("OBS_WEBSOCKET_OUTPUT_STOPPING"),
    STOPPED("OBS_WEBSOCKET_OUTPUT_STOPPED"),
    RECONNECTING("OBS_WEBSOCKET_OUTPUT_RECONNECTING"),
    RECONNECTED("OBS_WEBSOCKET_OUTPUT_RECONNECTED"),
    PAUSED("OBS_WEBSOCKET_OUTPUT_PAUSED"),
    RESUMED("OBS_WEBSOCKET_OUTPUT_RESUMED");

    private final String wireName;

    ObsOutputState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ObsOutputState fromWire(String wireName) {
        for (ObsOutputState s : values()) {
            if (s.wireName.equals(wireName)) {
                return s;
            }
        }
        return UNKNOWN;
    }
}
