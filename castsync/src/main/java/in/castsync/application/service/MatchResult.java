package in.castsync.application.service;

import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.Stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of matching newly observed platform broadcasts against known sessions.
 *
 * @param addedToExisting commonId to the snapshots attached to that existing session, in scan order
 * @param newStreams      sessions created for snapshots that matched nothing
 */
public record MatchResult(Map<String, List<PlatformStream>> addedToExisting, List<Stream> newStreams) {

    public MatchResult {
        addedToExisting = addedToExisting == null ? Map.of() : copyOrdered(addedToExisting);
        newStreams = newStreams == null ? List.of() : List.copyOf(newStreams);
    }

    public boolean isEmpty() {
        return addedToExisting.isEmpty() && newStreams.isEmpty();
    }

    private static Map<String, List<PlatformStream>> copyOrdered(Map<String, List<PlatformStream>> source) {
        Map<String, List<PlatformStream>> copy = new LinkedHashMap<>();
        source.forEach((commonId, streams) -> copy.put(commonId, List.copyOf(streams)));
        return Collections.unmodifiableMap(copy);
    }
}
