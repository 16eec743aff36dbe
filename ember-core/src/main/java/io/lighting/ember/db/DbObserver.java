package io.lighting.ember.db;

import io.lighting.ember.sql.RenderedSql;

/**
 * 数据库执行观察器。
 * <p>
 * 正常顺序为 {@link #beforeExecute} 然后 {@link #afterExecute}；执行失败时以 {@link #onExecuteError} 代替后者。
 * 各回调均为默认空实现。
 */
public interface DbObserver {
    /**
     * SQL 执行前回调。
     *
     * @param operation 操作类型
     * @param rendered  即将执行的 SQL 与绑定参数
     */
    default void beforeExecute(DbOperation operation, RenderedSql rendered) {
    }

    /**
     * SQL 执行后回调。
     *
     * @param operation    操作类型
     * @param rendered     已执行的 SQL
     * @param elapsedNanos 执行耗时（纳秒）
     * @param rowCount     查询返回行数或更新影响行数
     */
    default void afterExecute(DbOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
    }

    /**
     * SQL 执行失败回调。
     */
    default void onExecuteError(DbOperation operation, RenderedSql rendered, long elapsedNanos, Exception error) {
    }
}
