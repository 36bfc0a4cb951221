package in.castsync.application.service;

import in.castsync.domain.stream.Stream;
import in.castsync.domain.stream.StreamState;

/**
 * Snapshot of {@link ObsStreamDetector}.
 *
 * @param streaming     true only in {@link StreamState#LIVE}
 * @param currentStream session being recorded, or null
 */
public record DetectorStatus(boolean streaming, StreamState state, Stream currentStream) {}
