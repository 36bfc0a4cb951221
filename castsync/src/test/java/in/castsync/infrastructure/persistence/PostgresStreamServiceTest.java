package in.castsync.infrastructure.persistence;

import in.castsync.domain.stream.PlatformStreamRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;

import static in.castsync.domain.stream.StreamFixtures.at;
import static in.castsync.domain.stream.StreamFixtures.twitch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * JDBC mapping and error translation, against mocked JDBC objects.
 */
@ExtendWith(MockitoExtension.class)
class PostgresStreamServiceTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;

    private PostgresStreamService service;

    @BeforeEach
    void setUp() throws SQLException {
        service = new PostgresStreamService(dataSource, 1);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private void wireStatement() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
    }

    private static Throwable failureOf(Runnable call) {
        CompletionException e = assertThrows(CompletionException.class, call::run);
        return e.getCause();
    }

    @Test
    void createStreamBindsIdAndStart() throws SQLException {
        wireStatement();
        when(statement.executeUpdate()).thenReturn(1);

        service.createStream("s-1", at("14:00")).join();

        verify(statement).setString(1, "s-1");
        verify(statement).setTimestamp(2, Timestamp.from(at("14:00")));
        verify(connection).close();
    }

    @Test
    void duplicateStreamIsIllegalState() throws SQLException {
        wireStatement();
        when(statement.executeUpdate()).thenThrow(new SQLException("duplicate key", "23505"));

        Throwable cause = failureOf(() -> service.createStream("s-1", at("14:00")).join());

        assertInstanceOf(IllegalStateException.class, cause);
    }

    @Test
    void recordForMissingStreamIsNoSuchElement() throws SQLException {
        wireStatement();
        when(statement.executeUpdate()).thenThrow(new SQLException("fk violation", "23503"));

        Throwable cause = failureOf(() -> service.createPlatformStream("ghost", twitch(at("14:00"), null)).join());

        assertInstanceOf(NoSuchElementException.class, cause);
    }

    @Test
    void updatingMissingStreamIsNoSuchElement() throws SQLException {
        wireStatement();
        when(statement.executeUpdate()).thenReturn(0);

        Throwable cause = failureOf(() -> service.updateStreamEnd("ghost", at("16:00")).join());

        assertInstanceOf(NoSuchElementException.class, cause);
    }

    @Test
    void platformSnapshotStoredAsTaggedJson() throws SQLException {
        wireStatement();
        when(statement.executeUpdate()).thenReturn(1);

        PlatformStreamRecord record = service.createPlatformStream("s-1", twitch(at("14:00"), at("16:00"))).join();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertTrue(sql.getValue().contains("?::jsonb"));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(statement).setString(eq(4), json.capture());
        assertTrue(json.getValue().contains("\"platform\":\"twitch\""), json.getValue());
        verify(statement).setString(3, "twitch");
        assertEquals("s-1", record.commonId());
    }

    @Test
    void otherSqlErrorsAreWrapped() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused", "08001"));

        Throwable cause = failureOf(() -> service.deleteStream("s-1").join());

        assertInstanceOf(RuntimeException.class, cause);
        assertInstanceOf(SQLException.class, cause.getCause());
    }

    @Test
    void migrationCreatesMissingTables() throws SQLException {
        DatabaseMetaData metadata = mock(DatabaseMetaData.class);
        ResultSet noTable = mock(ResultSet.class);
        Statement ddl = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(metadata.getTables(any(), any(), anyString(), any())).thenReturn(noTable);
        when(noTable.next()).thenReturn(false);
        when(connection.createStatement()).thenReturn(ddl);

        new StreamSchemaMigration(dataSource).migrate();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(ddl, times(3)).execute(sql.capture());
        assertTrue(sql.getAllValues().get(0).contains("CREATE TABLE streams"));
        assertTrue(sql.getAllValues().get(1).contains("UNIQUE (common_id, platform)"));
        assertTrue(sql.getAllValues().get(2).startsWith("CREATE INDEX"));
    }

    @Test
    void migrationSkipsExistingTables() throws SQLException {
        DatabaseMetaData metadata = mock(DatabaseMetaData.class);
        ResultSet found = mock(ResultSet.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(metadata.getTables(any(), any(), anyString(), any())).thenReturn(found);
        when(found.next()).thenReturn(true);

        new StreamSchemaMigration(dataSource).migrate();

        verify(connection, never()).createStatement();
    }
}
