package in.castsync.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the session tables on startup if they are missing.
 *
 * - streams: one row per canonical session
 * - platform_streams: platform snapshots, at most one per platform per session
 */
public final class StreamSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(StreamSchemaMigration.class);

    private final DataSource dataSource;

    public StreamSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[STREAM STORE] Checking schema");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "streams")) {
                log.info("[STREAM STORE] Creating streams table...");
                execute(conn, """
                    CREATE TABLE streams (
                        common_id VARCHAR(64) PRIMARY KEY,
                        obs_start_time TIMESTAMPTZ NOT NULL,
                        obs_end_time TIMESTAMPTZ,
                        created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                    )
                    """);
                log.info("[STREAM STORE] ✓ streams table created");
            }

            if (!tableExists(conn, "platform_streams")) {
                log.info("[STREAM STORE] Creating platform_streams table...");
                execute(conn, """
                    CREATE TABLE platform_streams (
                        id VARCHAR(64) PRIMARY KEY,
                        common_id VARCHAR(64) NOT NULL REFERENCES streams(common_id) ON DELETE CASCADE,
                        platform VARCHAR(16) NOT NULL,
                        data JSONB NOT NULL,
                        created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                        seq BIGSERIAL,
                        UNIQUE (common_id, platform)
                    )
                    """);
                execute(conn, "CREATE INDEX idx_platform_streams_common_id ON platform_streams(common_id)");
                log.info("[STREAM STORE] ✓ platform_streams table created");
            }

            log.info("[STREAM STORE] Schema ready");

        } catch (SQLException e) {
            log.error("[STREAM STORE] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Stream schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
