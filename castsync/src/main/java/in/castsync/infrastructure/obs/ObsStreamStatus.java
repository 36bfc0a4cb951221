package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response data of {@code GetStreamStatus}.
 */
public record ObsStreamStatus(
    boolean active,
    boolean reconnecting,
    String timecode,
    long durationMs,
    double congestion,
    long bytes,
    long skippedFrames,
    long totalFrames
) {

    public static ObsStreamStatus fromResponseData(JsonNode d) {
        return new ObsStreamStatus(
            d.path("outputActive").asBoolean(false),
            d.path("outputReconnecting").asBoolean(false),
            d.path("outputTimecode").asText(""),
            d.path("outputDuration").asLong(0L),
            d.path("outputCongestion").asDouble(0.0),
            d.path("outputBytes").asLong(0L),
            d.path("outputSkippedFrames").asLong(0L),
            d.path("outputTotalFrames").asLong(0L)
        );
    }
}
