package io.lighting.ember.meta;

public interface SchemaRegistry {
    ModelSchema schemaOf(Class<?> modelType);
}
