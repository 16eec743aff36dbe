package io.lighting.ember.db;

import io.lighting.ember.sql.Bind;
import io.lighting.ember.sql.RenderedSql;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.LoggerFactory;

/**
 * SQL 执行日志观察器。
 * <p>
 * 通过 {@link Builder} 配置，构建后不可变。支持两种输出模式：分离（SQL + binds）或内联（将 ? 替换为格式化值）。
 * 内联模式仅用于日志展示，不影响真实执行的 SQL。默认输出到 SLF4J 的 {@code io.lighting.ember.sql} 日志器（INFO）。
 */
public final class SqlLog implements DbObserver {
    public enum Mode {
        SEPARATE,
        INLINE
    }

    private final boolean enabled;
    private final boolean includeElapsed;
    private final boolean includeRowCount;
    private final boolean includeOperation;
    private final Mode mode;
    private final String prefix;
    private final Consumer<String> sink;

    private SqlLog(Builder builder) {
        this.enabled = builder.enabled;
        this.includeElapsed = builder.includeElapsed;
        this.includeRowCount = builder.includeRowCount;
        this.includeOperation = builder.includeOperation;
        this.mode = builder.mode;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void beforeExecute(DbOperation operation, RenderedSql rendered) {
        if (!enabled) {
            return;
        }
        String content = mode == Mode.INLINE ? inlineSql(rendered) : separateSql(rendered);
        sink.accept(head(operation) + content);
    }

    @Override
    public void afterExecute(DbOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
        if (!enabled || (!includeRowCount && !includeElapsed)) {
            return;
        }
        List<String> parts = new ArrayList<>();
        if (includeRowCount) {
            parts.add("rows=" + rowCount);
        }
        if (includeElapsed) {
            parts.add("elapsed=" + elapsedNanos + "ns");
        }
        sink.accept(head(operation) + String.join(", ", parts));
    }

    @Override
    public void onExecuteError(DbOperation operation, RenderedSql rendered, long elapsedNanos, Exception error) {
        if (!enabled) {
            return;
        }
        sink.accept(head(operation) + "failed: " + error.getMessage());
    }

    private String head(DbOperation operation) {
        return includeOperation ? prefix + " [" + operation.name() + "] " : prefix + " ";
    }

    private String separateSql(RenderedSql rendered) {
        List<String> values = new ArrayList<>();
        for (Bind bind : rendered.binds()) {
            values.add(formatBind(bind));
        }
        return rendered.sql() + " | binds=[" + String.join(", ", values) + "]";
    }

    private String inlineSql(RenderedSql rendered) {
        List<Bind> binds = rendered.binds();
        String sql = rendered.sql();
        StringBuilder out = new StringBuilder(sql.length() + binds.size() * 8);
        int bindIndex = 0;
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (ch == '?' && bindIndex < binds.size()) {
                out.append(formatBind(binds.get(bindIndex++)));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private String formatBind(Bind bind) {
        if (bind instanceof Bind.Value value) {
            Object raw = value.value();
            if (raw instanceof Number) {
                return raw.toString();
            }
            return "'" + raw.toString().replace("'", "''") + "'";
        }
        return "NULL";
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean includeElapsed = false;
        private boolean includeRowCount = false;
        private boolean includeOperation = true;
        private Mode mode = Mode.SEPARATE;
        private String prefix = "SQL:";
        private Consumer<String> sink = LoggerFactory.getLogger("io.lighting.ember.sql")::info;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder includeRowCount(boolean enabled) {
            this.includeRowCount = enabled;
            return this;
        }

        public Builder includeOperation(boolean enabled) {
            this.includeOperation = enabled;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * 设置日志输出目标。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public SqlLog build() {
            return new SqlLog(this);
        }
    }
}
