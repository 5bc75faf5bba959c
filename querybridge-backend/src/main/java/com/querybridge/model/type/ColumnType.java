package com.querybridge.model.type;

/**
 * A driver-reported column type: {@link PrimitiveType}, {@link RowType}, {@link ArrayType}
 * or {@link MapType}.
 */
public interface ColumnType {

    /**
     * Type expression in the remote engine's syntax.
     *
     * @return type expression
     */
    String getDisplayName();
}
