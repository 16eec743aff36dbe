package io.lighting.ember.db;

import io.lighting.ember.jdbc.RowMapper;
import io.lighting.ember.sql.RenderedSql;
import java.sql.SQLException;
import java.util.List;

/**
 * 已渲染 SQL 的执行入口。
 */
public interface Db {
    default <T> List<T> fetch(RenderedSql sql, RowMapper<T> mapper) throws SQLException {
        return fetch(sql, mapper, 0);
    }

    /**
     * 最多读取 {@code maxRows} 行，0 表示不限制。
     */
    <T> List<T> fetch(RenderedSql sql, RowMapper<T> mapper, int maxRows) throws SQLException;

    int execute(RenderedSql sql) throws SQLException;
}
