package com.querybridge.model.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured type composed of sub-fields. Fields parsed from {@code row(bigint, varchar)}
 * carry no name.
 */
public final class RowType implements ColumnType {
    private final List<Field> fields;

    public RowType(List<Field> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * A row can only be navigated by name when every field has one.
     *
     * @return true when all fields are named
     */
    public boolean hasNamedFields() {
        if (fields.isEmpty()) {
            return false;
        }
        return fields.stream().allMatch(Field::isNamed);
    }

    @Override
    public String getDisplayName() {
        return fields.stream()
                .map(f -> f.isNamed() ? quoteIfNeeded(f.name()) + " " + f.type().getDisplayName() : f.type().getDisplayName())
                .collect(Collectors.joining(", ", "row(", ")"));
    }

    private static String quoteIfNeeded(String name) {
        if (name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            return name;
        }
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RowType other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return getDisplayName();
    }

    /**
     * One row field.
     *
     * @param name field name, null when unnamed
     * @param type field type
     */
    public record Field(String name, ColumnType type) {

        public Field {
            Objects.requireNonNull(type, "type");
        }

        public boolean isNamed() {
            return name != null && !name.isEmpty();
        }
    }
}
