package io.lighting.ember.sql.dialect;

import io.lighting.ember.sql.Bind;
import io.lighting.ember.sql.Dialect;
import io.lighting.ember.sql.RenderedPagination;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SQL:2008 {@code OFFSET ? ROWS FETCH NEXT ? ROWS ONLY}, e.g. SQL Server and Oracle 12c+.
 */
public final class OffsetFetchDialect implements Dialect {
    private final String id;
    private final boolean requireOrderBy;

    public OffsetFetchDialect(String id, boolean requireOrderBy) {
        this.id = Objects.requireNonNull(id, "id");
        this.requireOrderBy = requireOrderBy;
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
        if (requireOrderBy && !hasOrder) {
            throw new IllegalArgumentException("ORDER BY is required for pagination in " + id);
        }
        List<Bind> binds = new ArrayList<>(2);
        StringBuilder sql = new StringBuilder(" OFFSET ? ROWS");
        binds.add(new Bind.Value(offset == null ? 0 : requireNonNegative(offset, "offset"), Types.INTEGER));
        if (limit != null) {
            sql.append(" FETCH NEXT ? ROWS ONLY");
            binds.add(new Bind.Value(requireNonNegative(limit, "limit"), Types.INTEGER));
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
