package io.lighting.ember.active;

import io.lighting.ember.db.Db;
import io.lighting.ember.meta.ReflectionSchemaRegistry;
import io.lighting.ember.meta.SchemaRegistry;
import io.lighting.ember.sql.QueryRenderer;
import io.lighting.ember.sql.dialect.LimitOffsetDialect;
import java.util.Objects;

public final class ActiveRecordConfig {
    private final Db db;
    private final QueryRenderer renderer;
    private final SchemaRegistry schemaRegistry;

    private ActiveRecordConfig(Builder builder) {
        this.db = Objects.requireNonNull(builder.db, "db");
        this.renderer = Objects.requireNonNull(builder.renderer, "renderer");
        this.schemaRegistry = Objects.requireNonNull(builder.schemaRegistry, "schemaRegistry");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Db db() {
        return db;
    }

    public QueryRenderer renderer() {
        return renderer;
    }

    public SchemaRegistry schemaRegistry() {
        return schemaRegistry;
    }

    public static final class Builder {
        private Db db;
        private QueryRenderer renderer = new QueryRenderer(new LimitOffsetDialect());
        private SchemaRegistry schemaRegistry = new ReflectionSchemaRegistry();

        public Builder db(Db db) {
            this.db = db;
            return this;
        }

        public Builder renderer(QueryRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder schemaRegistry(SchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        public ActiveRecordConfig build() {
            return new ActiveRecordConfig(this);
        }
    }
}
