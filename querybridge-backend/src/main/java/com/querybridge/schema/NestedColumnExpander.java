package com.querybridge.schema;

import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.type.RowType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands ROW columns into one descriptor per nested field, depth first.
 *
 * <p>Only rows whose fields are all named are descended into; rows beneath an ARRAY or MAP
 * cannot be addressed by a dotted projection and stay unexpanded. Expanded fields are named
 * {@code foo.bar.baz} and selected with {@code "foo"."bar"."baz" AS "foo.bar.baz"}.
 */
@Component
public class NestedColumnExpander {

    public List<ColumnDescriptor> expandColumns(ColumnDescriptor column) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        expandInto(column, columns);
        return columns;
    }

    /**
     * Expand every base column, keeping column order.
     *
     * @param baseColumns base columns
     * @return base columns interleaved with their nested fields
     */
    public List<ColumnDescriptor> expandAll(List<ColumnDescriptor> baseColumns) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (ColumnDescriptor baseColumn : baseColumns) {
            expandInto(baseColumn, columns);
        }
        return columns;
    }

    private void expandInto(ColumnDescriptor column, List<ColumnDescriptor> out) {
        out.add(column);
        if (!(column.getType() instanceof RowType row) || !row.hasNamedFields()) {
            return;
        }

        for (RowType.Field field : row.getFields()) {
            List<String> path = new ArrayList<>(column.pathSegments());
            path.add(field.name());
            String name = column.getName() + "." + field.name();
            String queryName = path.stream()
                    .map(NestedColumnExpander::quote)
                    .collect(Collectors.joining("."));

            ColumnDescriptor inner = ColumnDescriptor.builder()
                    .name(name)
                    .columnName(name)
                    .type(field.type())
                    .declaredType(field.type().getDisplayName())
                    .temporal(TemporalTypes.isTemporal(field.type()))
                    .queryAs(queryName + " AS " + quote(name))
                    .path(List.copyOf(path))
                    .build();
            expandInto(inner, out);
        }
    }

    private static String quote(String segment) {
        return "\"" + segment.replace("\"", "\"\"") + "\"";
    }
}
