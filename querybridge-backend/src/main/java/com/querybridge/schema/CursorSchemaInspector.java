package com.querybridge.schema;

import com.querybridge.cursor.CursorFactory;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.TableRef;
import com.querybridge.model.type.ColumnType;
import com.querybridge.model.type.PrimitiveType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Describes tables by running catalog queries through a fresh cursor.
 */
@Slf4j
@Component
public class CursorSchemaInspector implements SchemaInspector {

    private final CursorFactory cursorFactory;

    public CursorSchemaInspector(CursorFactory cursorFactory) {
        this.cursorFactory = cursorFactory;
    }

    @Override
    public List<ColumnDescriptor> describeColumns(String databaseId, TableRef table) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT column_name, data_type FROM ");
        if (table.catalog() != null && !table.catalog().isBlank()) {
            sql.append(quoteIdentifier(table.catalog())).append('.');
        }
        sql.append("information_schema.columns WHERE table_name = ").append(quoteLiteral(table.table()));
        if (table.schema() != null && !table.schema().isBlank()) {
            sql.append(" AND table_schema = ").append(quoteLiteral(table.schema()));
        }
        sql.append(" ORDER BY ordinal_position");

        List<ColumnDescriptor> columns = toDescriptors(query(databaseId, sql.toString()));
        if (columns.isEmpty()) {
            throw new NoSuchTableException(table);
        }
        return columns;
    }

    @Override
    public List<ColumnDescriptor> describeColumnsFallback(String databaseId, TableRef table) throws SQLException {
        List<ColumnDescriptor> columns = toDescriptors(query(databaseId, "SHOW COLUMNS FROM " + qualifiedName(table)));
        if (columns.isEmpty()) {
            throw new NoSuchTableException(table);
        }
        return columns;
    }

    @Override
    public Optional<Map<String, Object>> latestPartition(String databaseId, TableRef table, List<String> partitionColumns)
            throws SQLException {
        if (partitionColumns.isEmpty()) {
            return Optional.empty();
        }
        String columns = partitionColumns.stream()
                .map(CursorSchemaInspector::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String orderBy = partitionColumns.stream()
                .map(column -> quoteIdentifier(column) + " DESC")
                .collect(Collectors.joining(", "));
        String sql = "SELECT " + columns + " FROM " + qualifiedName(partitionsTable(table))
                + " ORDER BY " + orderBy + " LIMIT 1";

        List<List<Object>> rows = query(databaseId, sql);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        List<Object> row = rows.get(0);
        Map<String, Object> latest = new LinkedHashMap<>();
        for (int i = 0; i < partitionColumns.size(); i++) {
            latest.put(partitionColumns.get(i), i < row.size() ? row.get(i) : null);
        }
        return Optional.of(latest);
    }

    @Override
    public String partitionQuery(TableRef table) {
        return "SELECT * FROM " + qualifiedName(partitionsTable(table));
    }

    @Override
    public Optional<String> viewDefinition(String databaseId, TableRef table) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT view_definition FROM ");
        if (table.catalog() != null && !table.catalog().isBlank()) {
            sql.append(quoteIdentifier(table.catalog())).append('.');
        }
        sql.append("information_schema.views WHERE table_name = ").append(quoteLiteral(table.table()));
        if (table.schema() != null && !table.schema().isBlank()) {
            sql.append(" AND table_schema = ").append(quoteLiteral(table.schema()));
        }

        List<List<Object>> rows = query(databaseId, sql.toString());
        if (rows.isEmpty() || rows.get(0).isEmpty() || rows.get(0).get(0) == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0).get(0).toString());
    }

    /**
     * The hidden table Trino exposes next to a partitioned table, one row per partition.
     *
     * @param table partitioned table
     * @return partitions table
     */
    public static TableRef partitionsTable(TableRef table) {
        return new TableRef(table.catalog(), table.schema(), table.table() + "$partitions");
    }

    private List<List<Object>> query(String databaseId, String sql) throws SQLException {
        try (CursorHandle cursor = cursorFactory.newCursor(databaseId)) {
            cursor.execute(sql);
            return cursor.fetchAll();
        }
    }

    private List<ColumnDescriptor> toDescriptors(List<List<Object>> rows) {
        List<ColumnDescriptor> columns = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() < 2 || row.get(0) == null) {
                continue;
            }
            String name = row.get(0).toString();
            String declaredType = row.get(1) != null ? row.get(1).toString() : "unknown";
            ColumnType type = parseType(name, declaredType);
            columns.add(ColumnDescriptor.builder()
                    .name(name)
                    .columnName(name)
                    .type(type)
                    .declaredType(declaredType)
                    .temporal(TemporalTypes.isTemporal(type))
                    .path(List.of(name))
                    .build());
        }
        return columns;
    }

    private ColumnType parseType(String column, String declaredType) {
        try {
            return TypeSignatureParser.parse(declaredType);
        } catch (IllegalArgumentException e) {
            log.warn("Unparseable type for column {}: {} ({})", column, declaredType, e.getMessage());
            return new PrimitiveType(declaredType, List.of(), declaredType);
        }
    }

    static String qualifiedName(TableRef table) {
        StringBuilder sb = new StringBuilder();
        if (table.catalog() != null && !table.catalog().isBlank()) {
            sb.append(quoteIdentifier(table.catalog())).append('.');
        }
        if (table.schema() != null && !table.schema().isBlank()) {
            sb.append(quoteIdentifier(table.schema())).append('.');
        }
        return sb.append(quoteIdentifier(table.table())).toString();
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
