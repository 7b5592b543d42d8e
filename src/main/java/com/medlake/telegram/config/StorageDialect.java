package com.medlake.telegram.config;

/**
 * SQL differences between the production database and the in-memory test database.
 * Both speak {@code INSERT ... ON CONFLICT DO NOTHING}; they differ in how JSON is typed and bound.
 */
public enum StorageDialect {

    POSTGRES("JSONB", "CAST(? AS JSONB)"),
    H2("JSON", "? FORMAT JSON");

    private final String jsonColumnType;
    private final String jsonBindExpression;

    StorageDialect(String jsonColumnType, String jsonBindExpression) {
        this.jsonColumnType = jsonColumnType;
        this.jsonBindExpression = jsonBindExpression;
    }

    public String jsonColumnType() {
        return jsonColumnType;
    }

    /** Placeholder expression that binds a JSON text parameter into a JSON column. */
    public String jsonBindExpression() {
        return jsonBindExpression;
    }
}
