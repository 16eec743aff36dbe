package io.lighting.ember.jdbc;

import io.lighting.ember.meta.ColumnMeta;
import io.lighting.ember.meta.ModelFields;
import io.lighting.ember.meta.ModelSchema;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Row mappers driven by a {@link ModelSchema}: records through their canonical constructor, other classes
 * through a no-arg constructor and field writes. Columns missing from the result set are left at their
 * default.
 */
public final class RowMappers {
    private RowMappers() {
    }

    public static <T> RowMapper<T> forSchema(Class<T> type, ModelSchema schema) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(schema, "schema");
        if (type.isRecord()) {
            return recordMapper(type, schema);
        }
        return beanMapper(type, schema);
    }

    private static <T> RowMapper<T> recordMapper(Class<T> type, ModelSchema schema) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] paramTypes = new Class<?>[components.length];
        String[] columns = new String[components.length];
        for (int i = 0; i < components.length; i++) {
            paramTypes[i] = components[i].getType();
            columns[i] = schema.column(components[i].getName()).columnName();
        }
        Constructor<T> ctor = constructor(type, paramTypes);
        return resultSet -> {
            Map<String, Integer> indexes = columnIndexes(resultSet);
            Object[] args = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                Integer index = indexes.get(normalize(columns[i]));
                Object value = index == null ? null : read(resultSet, index, paramTypes[i]);
                args[i] = value == null ? defaultValue(paramTypes[i]) : value;
            }
            try {
                return ctor.newInstance(args);
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
            }
        };
    }

    private static <T> RowMapper<T> beanMapper(Class<T> type, ModelSchema schema) {
        Constructor<T> ctor = constructor(type);
        List<ColumnMeta> columns = schema.columns();
        Field[] fields = new Field[columns.size()];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = ModelFields.field(type, columns.get(i).fieldName());
        }
        return resultSet -> {
            Map<String, Integer> indexes = columnIndexes(resultSet);
            T instance;
            try {
                instance = ctor.newInstance();
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
            }
            for (int i = 0; i < fields.length; i++) {
                Integer index = indexes.get(normalize(columns.get(i).columnName()));
                if (index == null) {
                    continue;
                }
                Field field = fields[i];
                Object value = read(resultSet, index, field.getType());
                if (value == null && field.getType().isPrimitive()) {
                    continue;
                }
                try {
                    field.set(instance, value);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
                }
            }
            return instance;
        };
    }

    private static Object read(ResultSet resultSet, int index, Class<?> type) throws SQLException {
        Object value = resultSet.getObject(index, wrapper(type));
        return resultSet.wasNull() ? null : value;
    }

    private static Map<String, Integer> columnIndexes(ResultSet resultSet) throws SQLException {
        ResultSetMetaData meta = resultSet.getMetaData();
        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String label = meta.getColumnLabel(i);
            if (label == null || label.isBlank()) {
                label = meta.getColumnName(i);
            }
            indexes.putIfAbsent(normalize(label), i);
        }
        return indexes;
    }

    private static Class<?> wrapper(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        return Character.class;
    }

    private static Object defaultValue(Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class) {
            return false;
        }
        if (type == char.class) {
            return '\0';
        }
        if (type == long.class) {
            return 0L;
        }
        if (type == double.class) {
            return 0d;
        }
        if (type == float.class) {
            return 0f;
        }
        if (type == short.class) {
            return (short) 0;
        }
        if (type == byte.class) {
            return (byte) 0;
        }
        return 0;
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static <T> Constructor<T> constructor(Class<T> type, Class<?>... parameterTypes) {
        try {
            Constructor<T> ctor = type.getDeclaredConstructor(parameterTypes);
            ctor.setAccessible(true);
            return ctor;
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException("No accessible constructor for " + type.getSimpleName(), ex);
        }
    }
}
