package io.lighting.ember.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.ember.jdbc.JdbcExecutor;
import io.lighting.ember.sql.Bind;
import io.lighting.ember.sql.RenderedSql;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultDbTest {
    private Connection connection;
    private final List<String> events = new ArrayList<>();
    private final List<String> logged = new ArrayList<>();
    private DefaultDb db;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:h2:mem:");
        DbObserver recorder = new DbObserver() {
            @Override
            public void beforeExecute(DbOperation operation, RenderedSql rendered) {
                events.add("before " + operation);
            }

            @Override
            public void afterExecute(DbOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
                events.add("after " + operation + " rows=" + rowCount);
            }

            @Override
            public void onExecuteError(
                DbOperation operation,
                RenderedSql rendered,
                long elapsedNanos,
                Exception error
            ) {
                events.add("error " + operation);
            }
        };
        SqlLog sqlLog = SqlLog.builder()
            .mode(SqlLog.Mode.INLINE)
            .includeOperation(false)
            .includeRowCount(true)
            .sink(logged::add)
            .build();
        db = new DefaultDb(new JdbcExecutor(connection), List.of(recorder, sqlLog));
        db.execute(new RenderedSql("CREATE TABLE notes (id INT, body VARCHAR(64))", List.of()));
        events.clear();
        logged.clear();
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    @Test
    void notifiesObserversAroundCommandsAndQueries() throws SQLException {
        int inserted = db.execute(new RenderedSql(
            "INSERT INTO notes VALUES (?, ?)",
            List.of(new Bind.Value(1L, Types.BIGINT), new Bind.Value("it's", Types.VARCHAR))
        ));
        List<String> bodies = db.fetch(
            new RenderedSql("SELECT body FROM notes WHERE id = ?", List.of(new Bind.Value(1, Types.INTEGER))),
            rs -> rs.getString(1)
        );

        assertEquals(1, inserted);
        assertEquals(List.of("it's"), bodies);
        assertEquals(List.of("before COMMAND", "after COMMAND rows=1", "before QUERY", "after QUERY rows=1"), events);
        assertEquals(List.of(
            "SQL: INSERT INTO notes VALUES (1, 'it''s')",
            "SQL: rows=1",
            "SQL: SELECT body FROM notes WHERE id = 1",
            "SQL: rows=1"
        ), logged);
    }

    @Test
    void bindsTypedNulls() throws SQLException {
        db.execute(new RenderedSql(
            "INSERT INTO notes VALUES (?, ?)",
            List.of(new Bind.Value(2, Types.INTEGER), new Bind.NullValue(Types.VARCHAR))
        ));

        List<String> bodies = db.fetch(new RenderedSql("SELECT body FROM notes", List.of()), rs -> rs.getString(1));

        assertEquals(1, bodies.size());
        assertNull(bodies.get(0));
        assertTrue(logged.get(0).endsWith("(2, NULL)"));
    }

    @Test
    void reportsFailuresAndRethrows() {
        assertThrows(SQLException.class, () -> db.fetch(
            new RenderedSql("SELECT * FROM missing_table", List.of()),
            rs -> rs.getString(1)
        ));

        assertEquals(List.of("before QUERY", "error QUERY"), events);
        assertTrue(logged.get(logged.size() - 1).startsWith("SQL: failed: "));
    }

    @Test
    void capsFetchedRows() throws SQLException {
        for (int id = 1; id <= 3; id++) {
            db.execute(new RenderedSql(
                "INSERT INTO notes VALUES (?, ?)",
                List.of(new Bind.Value(id, Types.INTEGER), new Bind.Value("n" + id, Types.VARCHAR))
            ));
        }
        RenderedSql all = new RenderedSql("SELECT id FROM notes ORDER BY id", List.of());

        assertEquals(List.of(1, 2), db.fetch(all, rs -> rs.getInt(1), 2));
        assertEquals(3, db.fetch(all, rs -> rs.getInt(1)).size());
        assertThrows(IllegalArgumentException.class, () -> db.fetch(all, rs -> rs.getInt(1), -1));
    }

    @Test
    void disabledLogStaysQuiet() throws SQLException {
        List<String> quiet = new ArrayList<>();
        SqlLog off = SqlLog.builder().enabled(false).sink(quiet::add).build();
        DefaultDb silent = new DefaultDb(new JdbcExecutor(connection), List.of(off));

        silent.fetch(new RenderedSql("SELECT COUNT(*) FROM notes", List.of()), rs -> rs.getLong(1));

        assertTrue(quiet.isEmpty());
    }

    @Test
    void defaultSinkWritesThroughSlf4j() throws SQLException {
        DefaultDb logging = new DefaultDb(new JdbcExecutor(connection), List.of(SqlLog.builder().build()));

        assertEquals(List.of(0L), logging.fetch(
            new RenderedSql("SELECT COUNT(*) FROM notes", List.of()),
            rs -> rs.getLong(1)
        ));
    }
}
