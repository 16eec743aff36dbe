package io.lighting.ember.jdbc;

import io.lighting.ember.sql.Bind;
import io.lighting.ember.sql.RenderedSql;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * 在 JDBC 上执行 {@link RenderedSql}。
 * <p>
 * 使用 {@link DataSource} 时每次调用各自借出并归还连接；使用 {@link Connection} 时连接由调用方持有和关闭。
 * 绑定参数总是带着 {@link Bind#jdbcType()} 下发，NULL 也按声明的类型绑定。
 */
public final class JdbcExecutor {
    @FunctionalInterface
    private interface StatementWork<R> {
        R run(PreparedStatement statement) throws SQLException;
    }

    private final DataSource dataSource;
    private final Connection shared;

    public JdbcExecutor(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.shared = null;
    }

    public JdbcExecutor(Connection connection) {
        this.shared = Objects.requireNonNull(connection, "connection");
        this.dataSource = null;
    }

    /**
     * 查询并映射结果，最多读取 {@code maxRows} 行，0 表示不限制。
     * 行数上限交给驱动处理，不改写 SQL，因此与方言的分页片段互不影响。
     */
    public <T> List<T> fetch(RenderedSql sql, RowMapper<T> mapper, int maxRows) throws SQLException {
        Objects.requireNonNull(mapper, "mapper");
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must be >= 0");
        }
        return withStatement(sql, statement -> {
            statement.setMaxRows(maxRows);
            List<T> rows = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    rows.add(mapper.map(resultSet));
                }
            }
            return rows;
        });
    }

    public int execute(RenderedSql sql) throws SQLException {
        return withStatement(sql, PreparedStatement::executeUpdate);
    }

    private <R> R withStatement(RenderedSql sql, StatementWork<R> work) throws SQLException {
        Objects.requireNonNull(sql, "sql");
        if (shared != null) {
            try (PreparedStatement statement = prepare(shared, sql)) {
                return work.run(statement);
            }
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, sql)) {
            return work.run(statement);
        }
    }

    private static PreparedStatement prepare(Connection connection, RenderedSql sql) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql.sql());
        try {
            int index = 1;
            for (Bind bind : sql.binds()) {
                if (bind instanceof Bind.Value value) {
                    statement.setObject(index, value.value(), value.jdbcType());
                } else {
                    statement.setNull(index, bind.jdbcType());
                }
                index++;
            }
            return statement;
        } catch (SQLException | RuntimeException ex) {
            statement.close();
            throw ex;
        }
    }
}
