package io.lighting.ember.sql;

import java.util.List;
import java.util.Objects;

public record RenderedPagination(String sqlFragment, List<Bind> binds) {
    public static final RenderedPagination NONE = new RenderedPagination("", List.of());

    public RenderedPagination {
        Objects.requireNonNull(sqlFragment, "sqlFragment");
        Objects.requireNonNull(binds, "binds");
        binds = List.copyOf(binds);
    }
}
