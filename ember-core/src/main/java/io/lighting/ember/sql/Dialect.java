package io.lighting.ember.sql;

public interface Dialect {
    String id();

    /**
     * 渲染 LIMIT/OFFSET 片段，两者都为 null 时返回 {@link RenderedPagination#NONE}。
     *
     * @param limit    最大行数，可为 null
     * @param offset   跳过的行数，可为 null
     * @param hasOrder 语句是否带有 ORDER BY
     */
    RenderedPagination renderLimitOffset(Integer limit, Integer offset, boolean hasOrder);
}
