package in.castsync.infrastructure.obs;

/**
 * Payload of a {@code StreamStateChanged} event.
 */
public record ObsStreamStateChanged(boolean outputActive, ObsOutputState outputState) {}
