package io.lighting.ember.meta;

import java.util.Objects;
import java.util.Optional;

public record ColumnMeta(
    String fieldName,
    String columnName,
    Class<?> javaType,
    boolean primaryKey,
    String uniqueLabel
) {
    public ColumnMeta {
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(javaType, "javaType");
        if (fieldName.isBlank() || columnName.isBlank()) {
            throw new IllegalArgumentException("Column mapping must not be blank: " + fieldName);
        }
        if (uniqueLabel != null && uniqueLabel.isBlank()) {
            throw new IllegalArgumentException("Unique label must not be blank: " + fieldName);
        }
    }

    public Optional<String> unique() {
        return Optional.ofNullable(uniqueLabel);
    }
}
