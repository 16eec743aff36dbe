package io.lighting.ember.sql;

import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code ?} markers and the binds in marker order.
 */
public record RenderedSql(String sql, List<Bind> binds) {
    public RenderedSql {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(binds, "binds");
        binds = List.copyOf(binds);
    }
}
