package in.castsync.application.service;

import java.time.Instant;

/**
 * Overlap between two time ranges, normalized by the shorter one.
 *
 * A short range entirely inside a long one scores 1.0, so platforms that go live or end a few
 * minutes apart from the local recording still match. Disjoint ranges, ranges that only touch,
 * and empty ranges score 0.
 */
public final class OverlapCalculator {

    private OverlapCalculator() {}

    /**
     * @return fraction in [0, 1]; symmetric in its arguments
     */
    public static double overlapPercent(TimeRange a, TimeRange b) {
        long durationA = a.duration().toMillis();
        long durationB = b.duration().toMillis();
        if (durationA <= 0 || durationB <= 0) {
            return 0.0;
        }
        Instant overlapStart = a.start().isAfter(b.start()) ? a.start() : b.start();
        Instant overlapEnd = a.end().isBefore(b.end()) ? a.end() : b.end();
        long overlap = Math.max(0L, overlapEnd.toEpochMilli() - overlapStart.toEpochMilli());
        return (double) overlap / Math.min(durationA, durationB);
    }
}
