package io.lighting.ember.sql;

import io.lighting.ember.meta.ModelSchema;
import io.lighting.ember.query.Order;
import io.lighting.ember.query.Placeholders;
import io.lighting.ember.query.Query;
import io.lighting.ember.query.Scalar;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 将 {@link Query} 渲染为可执行的 SELECT 语句：
 * <pre>
 * SELECT &lt;列&gt; FROM &lt;表&gt; [WHERE ...] [ORDER BY ...] [分页]
 * </pre>
 * filter 中的 {@code $n} 按出现顺序替换为 JDBC 的 {@code ?}，绑定列表与之一一对应，
 * 因此同一参数出现两次时会绑定两次。存在未绑定的值时拒绝渲染。
 */
public final class QueryRenderer {
    private final Dialect dialect;

    public QueryRenderer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * @throws IllegalStateException 存在未绑定的值，或 filter 引用了不存在的参数
     */
    public RenderedSql renderSelect(ModelSchema schema, Query query) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(query, "query");
        List<Integer> missing = query.missingValues();
        if (!missing.isEmpty()) {
            throw missingValue(missing.get(0));
        }
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(String.join(", ", schema.columnNames()))
            .append(" FROM ")
            .append(schema.table());
        List<Bind> binds = new ArrayList<>();
        List<Scalar> values = query.values();
        query.filter().ifPresent(filter -> sql.append(" WHERE ").append(Placeholders.replace(filter, index -> {
            if (index < 1 || index > values.size()) {
                throw missingValue(index);
            }
            binds.add(Bind.of(values.get(index - 1)));
            return "?";
        })));
        String order = orderBody(schema, query.order());
        if (order != null) {
            sql.append(" ORDER BY ").append(order);
        }
        RenderedPagination pagination = dialect.renderLimitOffset(
            boxed(query.limit()),
            boxed(query.offset()),
            order != null
        );
        sql.append(pagination.sqlFragment());
        binds.addAll(pagination.binds());
        return new RenderedSql(sql.toString(), binds);
    }

    private static String orderBody(ModelSchema schema, Order order) {
        if (order instanceof Order.Custom custom) {
            return custom.body();
        }
        if (order instanceof Order.Default) {
            return schema.defaultOrder().orElse(null);
        }
        return null;
    }

    private static Integer boxed(OptionalInt value) {
        return value.isPresent() ? Integer.valueOf(value.getAsInt()) : null;
    }

    private static IllegalStateException missingValue(int index) {
        return new IllegalStateException("Query value $" + index + " is missing");
    }
}
