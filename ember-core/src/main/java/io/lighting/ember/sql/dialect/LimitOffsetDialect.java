package io.lighting.ember.sql.dialect;

import io.lighting.ember.sql.Bind;
import io.lighting.ember.sql.Dialect;
import io.lighting.ember.sql.RenderedPagination;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code LIMIT ? OFFSET ?}, as understood by PostgreSQL, MySQL, SQLite and H2.
 */
public final class LimitOffsetDialect implements Dialect {
    private final String id;

    public LimitOffsetDialect() {
        this("limit-offset");
    }

    public LimitOffsetDialect(String id) {
        this.id = Objects.requireNonNull(id, "id");
        if (this.id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public RenderedPagination renderLimitOffset(Integer limit, Integer offset, boolean hasOrder) {
        if (limit == null && offset == null) {
            return RenderedPagination.NONE;
        }
        StringBuilder sql = new StringBuilder();
        List<Bind> binds = new ArrayList<>(2);
        if (limit != null) {
            sql.append(" LIMIT ?");
            binds.add(new Bind.Value(requireNonNegative(limit, "limit"), Types.INTEGER));
        }
        if (offset != null) {
            sql.append(" OFFSET ?");
            binds.add(new Bind.Value(requireNonNegative(offset, "offset"), Types.INTEGER));
        }
        return new RenderedPagination(sql.toString(), binds);
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }
}
