package in.castsync.infrastructure.persistence;

import in.castsync.application.port.output.StreamService;
import in.castsync.domain.stream.Platform;
import in.castsync.domain.stream.PlatformStream;
import in.castsync.domain.stream.PlatformStreamRecord;
import in.castsync.domain.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PostgreSQL implementation of StreamService.
 *
 * JDBC runs on a dedicated pool so callers on the control client's frame thread are never
 * blocked by the database. Platform snapshots are stored as JSONB in their platform-tagged form.
 */
public final class PostgresStreamService implements StreamService, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PostgresStreamService.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";

    private final DataSource dataSource;
    private final PlatformStreamJson json;
    private final ExecutorService executor;

    public PostgresStreamService(DataSource dataSource, int threads) {
        this.dataSource = dataSource;
        this.json = new PlatformStreamJson();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "stream-store-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> CompletableFuture<T> submit(String operation, String commonId, SqlWork<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            try (Connection conn = dataSource.getConnection()) {
                return work.run(conn);
            } catch (SQLException e) {
                log.error("[STREAM STORE] {} {} failed: {}", operation, commonId, e.getMessage());
                throw translate(operation, commonId, e);
            }
        }, executor);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SESSIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> createStream(String commonId, Instant obsStartTime) {
        String sql = """
                INSERT INTO streams (common_id, obs_start_time, created_at)
                VALUES (?, ?, ?)
                """;
        return submit("createStream", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, commonId);
                ps.setTimestamp(2, Timestamp.from(obsStartTime));
                ps.setTimestamp(3, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            }
            log.debug("[STREAM STORE] Created stream {} at {}", commonId, obsStartTime);
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<Stream>> getStream(String commonId) {
        return submit("getStream", commonId, conn -> findStream(conn, commonId));
    }

    @Override
    public CompletableFuture<Stream> getOrCreateStream(String commonId, Instant obsStartTime) {
        String sql = """
                INSERT INTO streams (common_id, obs_start_time, created_at)
                VALUES (?, ?, ?)
                ON CONFLICT (common_id) DO NOTHING
                """;
        return submit("getOrCreateStream", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, commonId);
                ps.setTimestamp(2, Timestamp.from(obsStartTime));
                ps.setTimestamp(3, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            }
            return findStream(conn, commonId).orElseThrow();
        });
    }

    @Override
    public CompletableFuture<Void> updateStreamEnd(String commonId, Instant obsEndTime) {
        String sql = "UPDATE streams SET obs_end_time = ? WHERE common_id = ?";
        return submit("updateStreamEnd", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setTimestamp(1, Timestamp.from(obsEndTime));
                ps.setString(2, commonId);
                if (ps.executeUpdate() == 0) {
                    throw new NoSuchElementException("Stream not found: " + commonId);
                }
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteStream(String commonId) {
        String sql = "DELETE FROM streams WHERE common_id = ?";
        return submit("deleteStream", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, commonId);
                ps.executeUpdate();
            }
            return null;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PLATFORM RECORDS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<PlatformStreamRecord> createPlatformStream(String commonId, PlatformStream platformStream) {
        String sql = """
                INSERT INTO platform_streams (id, common_id, platform, data, created_at)
                VALUES (?, ?, ?, ?::jsonb, ?)
                """;
        PlatformStreamRecord record = PlatformStreamRecord.create(commonId, platformStream);
        return submit("createPlatformStream", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, record.id());
                ps.setString(2, commonId);
                ps.setString(3, record.platform().code());
                ps.setString(4, json.encode(platformStream));
                ps.setTimestamp(5, Timestamp.from(record.createdAt()));
                ps.executeUpdate();
            }
            return record;
        });
    }

    @Override
    public CompletableFuture<List<PlatformStreamRecord>> getPlatformStreams(String commonId) {
        return submit("getPlatformStreams", commonId, conn -> findRecords(conn, commonId));
    }

    @Override
    public CompletableFuture<Void> removePlatformFromStream(String commonId, Platform platform) {
        String sql = "DELETE FROM platform_streams WHERE common_id = ? AND platform = ?";
        return submit("removePlatformFromStream", commonId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, commonId);
                ps.setString(2, platform.code());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Stream> getStreamWithPlatforms(String commonId) {
        return submit("getStreamWithPlatforms", commonId, conn -> findStream(conn, commonId)
            .orElseThrow(() -> new NoSuchElementException("Stream not found: " + commonId))
            .withPlatforms(findRecords(conn, commonId)));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ROW MAPPING
    // ═══════════════════════════════════════════════════════════════════════

    private Optional<Stream> findStream(Connection conn, String commonId) throws SQLException {
        String sql = """
                SELECT common_id, obs_start_time, obs_end_time, created_at
                FROM streams
                WHERE common_id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, commonId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Timestamp endTs = rs.getTimestamp("obs_end_time");
                    return Optional.of(new Stream(
                        rs.getString("common_id"),
                        rs.getTimestamp("obs_start_time").toInstant(),
                        endTs != null ? endTs.toInstant() : null,
                        rs.getTimestamp("created_at").toInstant(),
                        List.of()
                    ));
                }
            }
        }
        return Optional.empty();
    }

    private List<PlatformStreamRecord> findRecords(Connection conn, String commonId) throws SQLException {
        String sql = """
                SELECT id, common_id, platform, data::text AS data, created_at
                FROM platform_streams
                WHERE common_id = ?
                ORDER BY seq
                """;
        List<PlatformStreamRecord> records = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, commonId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new PlatformStreamRecord(
                        rs.getString("id"),
                        rs.getString("common_id"),
                        Platform.fromCode(rs.getString("platform")),
                        json.decode(rs.getString("data")),
                        rs.getTimestamp("created_at").toInstant()
                    ));
                }
            }
        }
        return records;
    }

    private static RuntimeException translate(String operation, String commonId, SQLException e) {
        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
            return new IllegalStateException(operation + ": duplicate for stream " + commonId, e);
        }
        if (FOREIGN_KEY_VIOLATION.equals(e.getSQLState())) {
            NoSuchElementException missing = new NoSuchElementException("Stream not found: " + commonId);
            missing.initCause(e);
            return missing;
        }
        return new RuntimeException("Failed to " + operation + " " + commonId, e);
    }
}
