package com.querybridge.model.type;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scalar type such as {@code bigint}, {@code varchar(10)} or
 * {@code timestamp(3) with time zone}.
 */
public final class PrimitiveType implements ColumnType {
    private final String baseName;
    private final List<String> parameters;
    private final String displayName;

    public PrimitiveType(String baseName, List<String> parameters, String displayName) {
        this.baseName = Objects.requireNonNull(baseName, "baseName").toLowerCase(Locale.ROOT);
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.displayName = displayName != null ? displayName : this.baseName;
    }

    public static PrimitiveType of(String baseName) {
        return new PrimitiveType(baseName, List.of(), baseName);
    }

    /**
     * Type name without parameters, e.g. {@code timestamp with time zone}.
     *
     * @return lowercased base name
     */
    public String getBaseName() {
        return baseName;
    }

    public List<String> getParameters() {
        return parameters;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrimitiveType other)) {
            return false;
        }
        return baseName.equals(other.baseName) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseName, parameters);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
