package com.querybridge.model;

/**
 * Fully or partially qualified table name.
 *
 * @param catalog catalog, may be null
 * @param schema schema, may be null
 * @param table table name
 */
public record TableRef(String catalog, String schema, String table) {

    public TableRef {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table is required");
        }
    }

    public static TableRef of(String schema, String table) {
        return new TableRef(null, schema, table);
    }
}
