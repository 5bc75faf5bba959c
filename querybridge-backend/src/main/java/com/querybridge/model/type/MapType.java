package com.querybridge.model.type;

import java.util.Objects;

public final class MapType implements ColumnType {
    private final ColumnType keyType;
    private final ColumnType valueType;

    public MapType(ColumnType keyType, ColumnType valueType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public ColumnType getKeyType() {
        return keyType;
    }

    public ColumnType getValueType() {
        return valueType;
    }

    @Override
    public String getDisplayName() {
        return "map(" + keyType.getDisplayName() + ", " + valueType.getDisplayName() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MapType other && keyType.equals(other.keyType) && valueType.equals(other.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyType, valueType);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
