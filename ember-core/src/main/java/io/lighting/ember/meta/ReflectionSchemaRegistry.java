package io.lighting.ember.meta;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Derives {@link ModelSchema} from {@link Table}, {@link Column}, {@link Id}, {@link Unique} and
 * {@link OrderBy} annotations. Superclass fields come after the subclass's own.
 */
public class ReflectionSchemaRegistry implements SchemaRegistry {
    private final ConcurrentMap<Class<?>, ModelSchema> cache = new ConcurrentHashMap<>();

    @Override
    public ModelSchema schemaOf(Class<?> modelType) {
        if (modelType == null) {
            throw new IllegalArgumentException("modelType must not be null");
        }
        return cache.computeIfAbsent(modelType, this::buildSchema);
    }

    private ModelSchema buildSchema(Class<?> modelType) {
        Table table = modelType.getAnnotation(Table.class);
        if (table == null) {
            throw new IllegalArgumentException("Missing @Table on " + modelType.getName());
        }
        if (table.name().isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank: " + modelType.getName());
        }

        ModelSchema.Builder builder = ModelSchema.builder(table.name());
        List<OrderItem> order = new ArrayList<>();
        for (Class<?> type = modelType; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Field field : type.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || Modifier.isTransient(field.getModifiers())) {
                    continue;
                }
                Column column = field.getAnnotation(Column.class);
                Id id = field.getAnnotation(Id.class);
                Unique unique = field.getAnnotation(Unique.class);
                OrderBy orderBy = field.getAnnotation(OrderBy.class);
                if (column == null && id == null && unique == null && orderBy == null) {
                    continue;
                }
                String columnName = column == null || column.name().isEmpty() ? field.getName() : column.name();
                if (columnName.isBlank()) {
                    throw new IllegalArgumentException(
                        "Column name must not be blank: " + modelType.getName() + "." + field.getName()
                    );
                }
                builder.add(new ColumnMeta(
                    field.getName(),
                    columnName,
                    field.getType(),
                    id != null,
                    unique == null ? null : unique.value()
                ));
                if (orderBy != null) {
                    order.add(new OrderItem(orderBy.priority(), order.size(), columnName, orderBy.direction()));
                }
            }
        }
        order.sort(Comparator.comparingInt(OrderItem::priority).thenComparingInt(OrderItem::position));
        for (OrderItem item : order) {
            builder.orderBy(item.column(), item.direction());
        }
        return builder.build();
    }

    private record OrderItem(int priority, int position, String column, OrderBy.Direction direction) {
    }
}
