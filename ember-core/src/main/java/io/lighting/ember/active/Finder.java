package io.lighting.ember.active;

import io.lighting.ember.jdbc.RowMapper;
import io.lighting.ember.jdbc.RowMappers;
import io.lighting.ember.meta.ColumnMeta;
import io.lighting.ember.meta.ModelFields;
import io.lighting.ember.meta.ModelSchema;
import io.lighting.ember.query.Query;
import io.lighting.ember.query.QueryBuilder;
import io.lighting.ember.query.Scalar;
import io.lighting.ember.sql.RenderedSql;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单个模型类型的查询入口。
 * <p>
 * 所有按键查找都通过 {@link QueryBuilder} 拼接 {@code col = $n AND ...}，再经
 * {@link io.lighting.ember.sql.QueryRenderer} 渲染执行。键中任一值为 null 时视为查无结果。
 *
 * @param <T> 模型类型
 */
public final class Finder<T> {
    private final ActiveRecordConfig config;
    private final ModelSchema schema;
    private final RowMapper<T> mapper;

    private Finder(ActiveRecordConfig config, Class<T> type) {
        this.config = config;
        this.schema = config.schemaRegistry().schemaOf(type);
        this.mapper = RowMappers.forSchema(type, schema);
    }

    public static <T> Finder<T> of(ActiveRecordConfig config, Class<T> type) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(type, "type");
        return new Finder<>(config, type);
    }

    public ModelSchema schema() {
        return schema;
    }

    /**
     * 按默认排序返回全部行。
     */
    public List<T> load() throws SQLException {
        return query(QueryBuilder.create().build().orElseThrow());
    }

    public List<T> query(Query query) throws SQLException {
        Objects.requireNonNull(query, "query");
        RenderedSql rendered = config.renderer().renderSelect(schema, query);
        return config.db().fetch(rendered, mapper);
    }

    /**
     * 按主键查找，复合主键按声明顺序传入。
     *
     * @throws IllegalArgumentException 参数个数与主键列数不一致
     */
    public Optional<T> find(Object... pk) throws SQLException {
        return lookup(schema.primaryKey(), pk);
    }

    /**
     * 按 {@link io.lighting.ember.meta.Unique} 分组查找。
     */
    public Optional<T> findBy(String label, Object... values) throws SQLException {
        return lookup(schema.uniqueGroup(label), values);
    }

    /**
     * 以 model 的主键值查找数据库中的对应行。
     */
    public Optional<T> findEqual(T model) throws SQLException {
        return lookup(schema.primaryKey(), valuesOf(model, schema.primaryKey()));
    }

    /**
     * 以 model 在指定唯一分组上的值查找。
     */
    public Optional<T> findEqual(T model, String label) throws SQLException {
        List<ColumnMeta> group = schema.uniqueGroup(label);
        return lookup(group, valuesOf(model, group));
    }

    /**
     * @throws ModelException 错误码 {@code <table>--not-found}
     */
    public void validateExists(Object... pk) throws SQLException {
        if (find(pk).isEmpty()) {
            throw new ModelException(schema.table() + "--not-found");
        }
    }

    /**
     * 依次检查每个唯一分组，已有相同取值的行时失败。
     *
     * @throws ModelException 错误码为分组列名以 {@code --} 连接后加 {@code --not-unique}
     */
    public void validateUnique(T model) throws SQLException {
        for (Map.Entry<String, List<ColumnMeta>> entry : schema.uniqueGroups().entrySet()) {
            if (findEqual(model, entry.getKey()).isPresent()) {
                throw new ModelException(uniqueCode(entry.getValue()));
            }
        }
    }

    private Optional<T> lookup(List<ColumnMeta> columns, Object[] values) throws SQLException {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No key columns on " + schema.table());
        }
        if (values == null || values.length != columns.size()) {
            int given = values == null ? 0 : values.length;
            throw new IllegalArgumentException(
                "Expected " + columns.size() + " key values for " + schema.table() + " but got " + given
            );
        }
        QueryBuilder builder = QueryBuilder.create();
        for (int i = 0; i < columns.size(); i++) {
            if (values[i] == null) {
                return Optional.empty();
            }
            String column = columns.get(i).columnName();
            builder = i == 0 ? builder.col(column) : builder.and(column);
            builder = builder.eq(Scalar.of(values[i]));
        }
        Query query = builder.noOrder().build()
            .orElseThrow(() -> new IllegalStateException("Invalid key lookup on " + schema.table()));
        // two rows are enough to tell a unique match from an ambiguous one
        List<T> rows = config.db().fetch(config.renderer().renderSelect(schema, query), mapper, 2);
        return rows.size() == 1 ? Optional.of(rows.get(0)) : Optional.empty();
    }

    private Object[] valuesOf(T model, List<ColumnMeta> columns) {
        Objects.requireNonNull(model, "model");
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = ModelFields.read(model, columns.get(i).fieldName());
        }
        return values;
    }

    private static String uniqueCode(List<ColumnMeta> group) {
        List<String> names = new ArrayList<>();
        for (ColumnMeta column : group) {
            names.add(column.columnName());
        }
        return String.join("--", names) + "--not-unique";
    }
}
