package in.castsync.application.service;

import in.castsync.application.port.output.StreamService;
import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.PlatformStreamRecord;
import in.castsync.domain.stream.Stream;
import in.castsync.infrastructure.metrics.DaemonMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * StreamMatcher - groups platform broadcasts into canonical sessions by time overlap.
 *
 * Two ranges belong to the same session when {@link OverlapCalculator#overlapPercent} reaches
 * the threshold. Open-ended ranges run until "now".
 *
 * Every operation blocks on its store calls and is not retried. A failure part-way through a
 * batch leaves the groups already written in place.
 *
 * Usage:
 * <pre>
 * StreamMatcher matcher = new StreamMatcher(streamService, 0.85);
 * List&lt;Stream&gt; sessions = matcher.matchAllPlatformStreams(twitch, kick, youtube);
 * </pre>
 */
public final class StreamMatcher {
    private static final Logger log = LoggerFactory.getLogger(StreamMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.85;

    private final StreamService streamService;
    private final double threshold;
    private final DaemonMetrics metrics;
    private final Clock clock;
    private final Supplier<String> idSupplier;

    public StreamMatcher(StreamService streamService) {
        this(streamService, DEFAULT_THRESHOLD);
    }

    public StreamMatcher(StreamService streamService, double threshold) {
        this(streamService, threshold, DaemonMetrics.NOOP, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public StreamMatcher(
            StreamService streamService,
            double threshold,
            DaemonMetrics metrics,
            Clock clock,
            Supplier<String> idSupplier) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
        this.streamService = Objects.requireNonNull(streamService, "streamService");
        this.threshold = threshold;
        this.metrics = metrics;
        this.clock = clock;
        this.idSupplier = idSupplier;
    }

    public double getThreshold() {
        return threshold;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // BATCH MATCHING
    // ═══════════════════════════════════════════════════════════════════════

    public List<Stream> matchAllPlatformStreams(
            List<? extends PlatformStream> twitchStreams,
            List<? extends PlatformStream> kickStreams,
            List<? extends PlatformStream> youtubeStreams) {
        return matchAllPlatformStreams(List.of(twitchStreams, kickStreams, youtubeStreams));
    }

    /**
     * Group every snapshot into sessions and persist them.
     *
     * Snapshots are taken in start order and each joins the first group whose span (first
     * member's start to the latest member end) it overlaps enough, otherwise it opens a new
     * group. A group never takes a second snapshot from a platform it already holds. One
     * left-to-right pass; not a globally optimal clustering.
     *
     * @param perPlatform one list per platform
     * @return created sessions with their platform records, in group order
     */
    public List<Stream> matchAllPlatformStreams(List<? extends List<? extends PlatformStream>> perPlatform) {
        Instant now = clock.instant();
        List<PlatformStream> all = new ArrayList<>();
        perPlatform.forEach(all::addAll);
        all.sort(Comparator.comparing(PlatformStream::startTime));

        List<List<PlatformStream>> groups = new ArrayList<>();
        for (PlatformStream candidate : all) {
            TimeRange range = TimeRange.of(candidate, now);
            List<PlatformStream> target = null;
            for (List<PlatformStream> group : groups) {
                if (holdsPlatform(group, candidate)) {
                    continue;
                }
                if (OverlapCalculator.overlapPercent(groupSpan(group, now), range) >= threshold) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                groups.add(target);
            }
            target.add(candidate);
        }

        log.info("[MATCHER] {} platform broadcast(s) grouped into {} session(s)", all.size(), groups.size());

        List<Stream> result = new ArrayList<>(groups.size());
        for (List<PlatformStream> group : groups) {
            result.add(persistGroup(group));
        }
        return result;
    }

    private Stream persistGroup(List<PlatformStream> group) {
        String commonId = idSupplier.get();
        Instant earliestStart = group.get(0).startTime();

        StreamPersistenceException.await(streamService.createStream(commonId, earliestStart), "createStream", commonId);
        metrics.recordSessionCreated("matcher");
        for (PlatformStream member : group) {
            StreamPersistenceException.await(streamService.createPlatformStream(commonId, member),
                "createPlatformStream", commonId);
        }

        boolean allEnded = group.stream().allMatch(s -> s.endTime() != null);
        if (allEnded) {
            Instant latestEnd = group.stream().map(PlatformStream::endTime).max(Comparator.naturalOrder()).orElseThrow();
            StreamPersistenceException.await(streamService.updateStreamEnd(commonId, latestEnd),
                "updateStreamEnd", commonId);
        }

        log.debug("[MATCHER] Session {} created with {} platform(s)", commonId, group.size());
        return StreamPersistenceException.await(streamService.getStreamWithPlatforms(commonId),
            "getStreamWithPlatforms", commonId);
    }

    private static boolean holdsPlatform(List<PlatformStream> group, PlatformStream candidate) {
        return group.stream().anyMatch(member -> member.platform() == candidate.platform());
    }

    private static TimeRange groupSpan(List<PlatformStream> group, Instant now) {
        Instant end = group.get(0).startTime();
        for (PlatformStream member : group) {
            Instant memberEnd = member.endTime() != null ? member.endTime() : now;
            if (memberEnd.isAfter(end)) {
                end = memberEnd;
            }
        }
        return new TimeRange(group.get(0).startTime(), end);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INCREMENTAL MATCHING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Attach newly seen snapshots to known sessions, creating sessions for the rest.
     *
     * Each snapshot goes to the first session, in the order given, whose span it overlaps
     * enough and that has no record for its platform yet. Sessions for unmatched snapshots are
     * created concurrently and all awaited.
     */
    public MatchResult matchNewPlatformStreams(List<Stream> existingStreams,
                                               List<? extends PlatformStream> newPlatformStreams) {
        Instant now = clock.instant();
        Map<String, List<PlatformStream>> addedToExisting = new LinkedHashMap<>();
        Map<String, CompletableFuture<Stream>> creations = new LinkedHashMap<>();

        for (PlatformStream candidate : newPlatformStreams) {
            TimeRange range = TimeRange.of(candidate, now);
            Stream match = null;
            for (Stream existing : existingStreams) {
                if (existing.platform(candidate.platform()).isPresent()
                        || addedToExisting.getOrDefault(existing.commonId(), List.of()).stream()
                            .anyMatch(added -> added.platform() == candidate.platform())) {
                    continue;
                }
                if (OverlapCalculator.overlapPercent(TimeRange.of(existing, now), range) >= threshold) {
                    match = existing;
                    break;
                }
            }

            if (match != null) {
                String commonId = match.commonId();
                StreamPersistenceException.await(streamService.createPlatformStream(commonId, candidate),
                    "createPlatformStream", commonId);
                addedToExisting.computeIfAbsent(commonId, id -> new ArrayList<>()).add(candidate);
                log.info("[MATCHER] {} {} joined session {}", candidate.platform(), candidate.title(), commonId);
            } else {
                String commonId = idSupplier.get();
                creations.put(commonId, streamService.createStream(commonId, candidate.startTime())
                    .thenCompose(v -> streamService.createPlatformStream(commonId, candidate))
                    .thenCompose(record -> streamService.getStreamWithPlatforms(commonId)));
            }
        }

        // wait for every creation before surfacing the first failure
        CompletableFuture.allOf(creations.values().toArray(new CompletableFuture[0]))
            .exceptionally(error -> null)
            .join();
        List<Stream> newStreams = new ArrayList<>(creations.size());
        creations.forEach((commonId, future) ->
            newStreams.add(StreamPersistenceException.await(future, "createStream", commonId)));
        newStreams.forEach(s -> metrics.recordSessionCreated("matcher"));

        if (!newStreams.isEmpty()) {
            log.info("[MATCHER] {} new session(s) detected", newStreams.size());
        }
        return new MatchResult(addedToExisting, newStreams);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SPLIT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Move the first platform record that no longer overlaps its session into a session of its own.
     *
     * At most one record moves per call. When records remain, the old session's end becomes
     * their latest end, if any of them has one; when none remain, the old session is deleted.
     *
     * @return {@code [stream]} when nothing moved, {@code [old, new]} after a split,
     *         or {@code [new]} when the old session was emptied
     */
    public List<Stream> splitStream(Stream stream) {
        String commonId = stream.commonId();
        Instant now = clock.instant();
        TimeRange span = TimeRange.of(stream, now);

        List<PlatformStreamRecord> records = StreamPersistenceException.await(
            streamService.getPlatformStreams(commonId), "getPlatformStreams", commonId);

        PlatformStreamRecord misaligned = null;
        for (PlatformStreamRecord record : records) {
            if (OverlapCalculator.overlapPercent(span, TimeRange.of(record.data(), now)) < threshold) {
                misaligned = record;
                break;
            }
        }
        if (misaligned == null) {
            return List.of(stream);
        }

        PlatformStream data = misaligned.data();
        String newCommonId = idSupplier.get();
        log.info("[MATCHER] Splitting {} out of session {} into {}", misaligned.platform(), commonId, newCommonId);

        // the record stays on the old session until the new one owns a copy
        StreamPersistenceException.await(streamService.createStream(newCommonId, data.startTime()),
            "createStream", newCommonId);
        StreamPersistenceException.await(streamService.createPlatformStream(newCommonId, data),
            "createPlatformStream", newCommonId);
        StreamPersistenceException.await(streamService.removePlatformFromStream(commonId, misaligned.platform()),
            "removePlatformFromStream", commonId);
        Stream newStream = StreamPersistenceException.await(streamService.getStreamWithPlatforms(newCommonId),
            "getStreamWithPlatforms", newCommonId);
        metrics.recordSessionCreated("matcher");
        metrics.recordSplit();

        List<PlatformStreamRecord> remaining = StreamPersistenceException.await(
            streamService.getPlatformStreams(commonId), "getPlatformStreams", commonId);
        if (remaining.isEmpty()) {
            log.info("[MATCHER] Session {} emptied by split, deleting", commonId);
            StreamPersistenceException.await(streamService.deleteStream(commonId), "deleteStream", commonId);
            return List.of(newStream);
        }

        remaining.stream()
            .map(r -> r.data().endTime())
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .ifPresent(latestEnd -> StreamPersistenceException.await(
                streamService.updateStreamEnd(commonId, latestEnd), "updateStreamEnd", commonId));

        Stream refreshed = StreamPersistenceException.await(streamService.getStreamWithPlatforms(commonId),
            "getStreamWithPlatforms", commonId);
        return List.of(refreshed, newStream);
    }
}
