package in.castsync.domain.stream;

/**
 * Local recorder session state as derived by the detector. Not persisted.
 */
public enum StreamState {
    OFFLINE,
    STARTING,
    LIVE,
    STOPPING,
    RECONNECTING
}
