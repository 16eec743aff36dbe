package io.lighting.ember.meta;

import io.lighting.ember.query.Scalar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 模型的运行期描述：表名、列、主键、默认排序以及唯一约束分组。
 * <p>
 * 可由 {@link ReflectionSchemaRegistry} 从注解推导，也可通过 {@link #builder(String)} 手工声明。
 * 主键列与唯一分组列会被转成查询参数，类型必须是 {@link Scalar#supports(Class)} 接受的类型。
 */
public final class ModelSchema {
    private final String table;
    private final List<ColumnMeta> columns;
    private final List<ColumnMeta> primaryKey;
    private final String defaultOrder;
    private final Map<String, List<ColumnMeta>> uniqueGroups;
    private final Map<String, ColumnMeta> byField;

    private ModelSchema(String table, List<ColumnMeta> columns, String defaultOrder) {
        Objects.requireNonNull(table, "table");
        if (table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No columns mapped for table " + table);
        }
        Set<String> names = new LinkedHashSet<>();
        Map<String, ColumnMeta> fields = new LinkedHashMap<>();
        List<ColumnMeta> keys = new ArrayList<>();
        Map<String, List<ColumnMeta>> groups = new LinkedHashMap<>();
        for (ColumnMeta column : columns) {
            if (!names.add(column.columnName())) {
                throw new IllegalArgumentException("Duplicate column mapping: " + column.columnName());
            }
            if (fields.put(column.fieldName(), column) != null) {
                throw new IllegalArgumentException("Duplicate field mapping: " + column.fieldName());
            }
            if ((column.primaryKey() || column.uniqueLabel() != null) && !Scalar.supports(column.javaType())) {
                throw new IllegalArgumentException(
                    "Key column " + table + "." + column.columnName() + " has unsupported type "
                        + column.javaType().getName() + "; use an integer, floating point or string type"
                );
            }
            if (column.primaryKey()) {
                keys.add(column);
            }
            column.unique().ifPresent(label -> groups.computeIfAbsent(label, ignored -> new ArrayList<>()).add(column));
        }
        Map<String, List<ColumnMeta>> frozen = new LinkedHashMap<>();
        groups.forEach((label, group) -> frozen.put(label, List.copyOf(group)));
        this.table = table;
        this.columns = List.copyOf(columns);
        this.primaryKey = List.copyOf(keys);
        this.defaultOrder = defaultOrder == null || defaultOrder.isBlank() ? null : defaultOrder;
        this.uniqueGroups = Collections.unmodifiableMap(frozen);
        this.byField = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    public String table() {
        return table;
    }

    public List<ColumnMeta> columns() {
        return columns;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnMeta column : columns) {
            names.add(column.columnName());
        }
        return names;
    }

    public List<ColumnMeta> primaryKey() {
        return primaryKey;
    }

    /**
     * 默认 ORDER BY 主体，不含 "ORDER BY"。
     */
    public Optional<String> defaultOrder() {
        return Optional.ofNullable(defaultOrder);
    }

    /**
     * label 到列的映射，label 按首次出现排序，组内按声明顺序。
     */
    public Map<String, List<ColumnMeta>> uniqueGroups() {
        return uniqueGroups;
    }

    public List<ColumnMeta> uniqueGroup(String label) {
        List<ColumnMeta> group = uniqueGroups.get(label);
        if (group == null) {
            throw new IllegalArgumentException("Unknown unique label " + label + " on " + table);
        }
        return group;
    }

    public ColumnMeta column(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        ColumnMeta column = byField.get(fieldName);
        if (column == null) {
            throw new IllegalArgumentException("Unknown field: " + fieldName);
        }
        return column;
    }

    public static final class Builder {
        private final String table;
        private final List<ColumnMeta> columns = new ArrayList<>();
        private final List<String> order = new ArrayList<>();

        private Builder(String table) {
            this.table = table;
        }

        public Builder column(String fieldName, String columnName, Class<?> javaType) {
            columns.add(new ColumnMeta(fieldName, columnName, javaType, false, null));
            return this;
        }

        public Builder id(String fieldName, String columnName, Class<?> javaType) {
            columns.add(new ColumnMeta(fieldName, columnName, javaType, true, null));
            return this;
        }

        public Builder unique(String fieldName, String columnName, Class<?> javaType, String label) {
            columns.add(new ColumnMeta(fieldName, columnName, javaType, false, label));
            return this;
        }

        public Builder add(ColumnMeta column) {
            columns.add(Objects.requireNonNull(column, "column"));
            return this;
        }

        /**
         * 追加默认排序项，按调用顺序组合。
         */
        public Builder orderBy(String columnName, OrderBy.Direction direction) {
            Objects.requireNonNull(columnName, "columnName");
            Objects.requireNonNull(direction, "direction");
            order.add(direction == OrderBy.Direction.DESC ? columnName + " DESC" : columnName);
            return this;
        }

        public ModelSchema build() {
            return new ModelSchema(table, columns, String.join(", ", order));
        }
    }
}
