package com.querybridge.schema;

import com.querybridge.error.ExceptionTaxonomyMapper;
import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.DatabaseInfo;
import com.querybridge.model.TableRef;
import com.querybridge.service.DatabaseRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;

@Slf4j
@Service
public class ColumnService {

    private final DatabaseRegistry databaseRegistry;
    private final SchemaInspector schemaInspector;
    private final NestedColumnExpander expander;
    private final ExceptionTaxonomyMapper exceptionMapper;

    public ColumnService(
            DatabaseRegistry databaseRegistry,
            SchemaInspector schemaInspector,
            NestedColumnExpander expander,
            ExceptionTaxonomyMapper exceptionMapper
    ) {
        this.databaseRegistry = databaseRegistry;
        this.schemaInspector = schemaInspector;
        this.expander = expander;
        this.exceptionMapper = exceptionMapper;
    }

    /**
     * Describe a table's columns, optionally expanding nested rows into dotted paths.
     *
     * @param databaseId registered database id
     * @param table table
     * @param expandRows overrides the database's expand-rows setting when not null
     * @return columns
     */
    public List<ColumnDescriptor> getColumns(String databaseId, TableRef table, Boolean expandRows) {
        DatabaseInfo database = databaseRegistry.requireDatabase(databaseId);

        List<ColumnDescriptor> baseColumns;
        try {
            try {
                baseColumns = schemaInspector.describeColumns(databaseId, table);
            } catch (NoSuchTableException e) {
                log.debug("information_schema has no columns for {}, falling back to SHOW COLUMNS", table);
                baseColumns = schemaInspector.describeColumnsFallback(databaseId, table);
            }
        } catch (SQLException e) {
            throw exceptionMapper.translate(e);
        }

        boolean expand = expandRows != null ? expandRows : database.isExpandRows();
        if (!expand) {
            return baseColumns;
        }
        return expander.expandAll(baseColumns);
    }
}
