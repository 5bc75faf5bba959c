package com.querybridge.schema;

import com.querybridge.model.TableRef;

/**
 * Thrown when the catalog reports no columns for a table; for Trino this also happens when
 * the table exists but has never held rows.
 */
public class NoSuchTableException extends RuntimeException {
    private final transient TableRef table;

    public NoSuchTableException(TableRef table) {
        super("No such table: " + describe(table));
        this.table = table;
    }

    public TableRef getTable() {
        return table;
    }

    private static String describe(TableRef table) {
        StringBuilder sb = new StringBuilder();
        if (table.catalog() != null) {
            sb.append(table.catalog()).append('.');
        }
        if (table.schema() != null) {
            sb.append(table.schema()).append('.');
        }
        return sb.append(table.table()).toString();
    }
}
