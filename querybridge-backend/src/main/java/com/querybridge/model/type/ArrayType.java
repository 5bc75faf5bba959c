package com.querybridge.model.type;

import java.util.Objects;

public final class ArrayType implements ColumnType {
    private final ColumnType elementType;

    public ArrayType(ColumnType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public ColumnType getElementType() {
        return elementType;
    }

    @Override
    public String getDisplayName() {
        return "array(" + elementType.getDisplayName() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayType other && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31;
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
