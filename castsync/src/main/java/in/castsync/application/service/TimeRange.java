package in.castsync.application.service;

import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.Stream;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed interval used for overlap scoring. Open ends are substituted with "now" by the factories.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        // an end before the start (clock skew, bad platform data) collapses to an empty range
        if (end.isBefore(start)) {
            end = start;
        }
    }

    public static TimeRange of(PlatformStream platformStream, Instant now) {
        Instant end = platformStream.endTime() != null ? platformStream.endTime() : now;
        return new TimeRange(platformStream.startTime(), end);
    }

    public static TimeRange of(Stream stream, Instant now) {
        return new TimeRange(stream.obsStartTime(), stream.effectiveEnd(now));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
