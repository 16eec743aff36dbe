package io.lighting.ember.db;

import io.lighting.ember.jdbc.JdbcExecutor;
import io.lighting.ember.jdbc.RowMapper;
import io.lighting.ember.sql.RenderedSql;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DefaultDb implements Db {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultDb.class);

    private final JdbcExecutor executor;
    private final List<DbObserver> observers;

    public DefaultDb(JdbcExecutor executor) {
        this(executor, List.of());
    }

    public DefaultDb(JdbcExecutor executor, List<DbObserver> observers) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    }

    @Override
    public <T> List<T> fetch(RenderedSql sql, RowMapper<T> mapper, int maxRows) throws SQLException {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(mapper, "mapper");
        notifyBeforeExecute(DbOperation.QUERY, sql);
        long start = System.nanoTime();
        try {
            List<T> results = executor.fetch(sql, mapper, maxRows);
            notifyAfterExecute(DbOperation.QUERY, sql, start, results.size());
            return results;
        } catch (SQLException | RuntimeException ex) {
            notifyExecuteError(DbOperation.QUERY, sql, start, ex);
            throw ex;
        }
    }

    @Override
    public int execute(RenderedSql sql) throws SQLException {
        Objects.requireNonNull(sql, "sql");
        notifyBeforeExecute(DbOperation.COMMAND, sql);
        long start = System.nanoTime();
        try {
            int updated = executor.execute(sql);
            notifyAfterExecute(DbOperation.COMMAND, sql, start, updated);
            return updated;
        } catch (SQLException | RuntimeException ex) {
            notifyExecuteError(DbOperation.COMMAND, sql, start, ex);
            throw ex;
        }
    }

    private void notifyBeforeExecute(DbOperation operation, RenderedSql rendered) {
        for (DbObserver observer : observers) {
            observer.beforeExecute(operation, rendered);
        }
    }

    private void notifyAfterExecute(DbOperation operation, RenderedSql rendered, long start, int rowCount) {
        long elapsed = System.nanoTime() - start;
        for (DbObserver observer : observers) {
            observer.afterExecute(operation, rendered, elapsed, rowCount);
        }
    }

    private void notifyExecuteError(DbOperation operation, RenderedSql rendered, long start, Exception error) {
        long elapsed = System.nanoTime() - start;
        LOG.warn("{} failed after {}ns: {}", operation, elapsed, rendered.sql(), error);
        for (DbObserver observer : observers) {
            observer.onExecuteError(operation, rendered, elapsed, error);
        }
    }
}
