package io.lighting.ember.db;

public enum DbOperation {
    QUERY,
    COMMAND
}
