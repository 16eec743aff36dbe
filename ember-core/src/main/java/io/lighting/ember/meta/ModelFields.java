package io.lighting.ember.meta;

import java.lang.reflect.Field;

/**
 * Reflective access to model fields by name, searching superclasses too.
 */
public final class ModelFields {
    private ModelFields() {
    }

    /**
     * @throws IllegalArgumentException if neither the type nor a superclass declares the field
     */
    public static Field field(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name)) {
                    field.setAccessible(true);
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("No field " + name + " on " + type.getName());
    }

    public static Object read(Object model, String fieldName) {
        Field field = field(model.getClass(), fieldName);
        try {
            return field.get(model);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException(
                "Failed to read " + fieldName + " from " + model.getClass().getSimpleName(),
                ex
            );
        }
    }
}
