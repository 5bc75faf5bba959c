package com.querybridge.schema;

import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.TableRef;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface SchemaInspector {

    /**
     * Describe columns through the catalog's standard metadata tables.
     *
     * @param databaseId registered database id
     * @param table table
     * @return columns in ordinal order
     * @throws NoSuchTableException if the catalog reports no columns
     */
    List<ColumnDescriptor> describeColumns(String databaseId, TableRef table) throws SQLException;

    /**
     * Describe columns by a path that does not depend on the table holding rows.
     *
     * @param databaseId registered database id
     * @param table table
     * @return columns in ordinal order
     * @throws NoSuchTableException if the table does not exist
     */
    List<ColumnDescriptor> describeColumnsFallback(String databaseId, TableRef table) throws SQLException;

    /**
     * Values of the newest partition, ordering every partition column descending.
     *
     * @param databaseId registered database id
     * @param table partitioned table
     * @param partitionColumns partition columns to read and order by
     * @return values keyed by column, empty when the table has no partitions
     */
    Optional<Map<String, Object>> latestPartition(String databaseId, TableRef table, List<String> partitionColumns)
            throws SQLException;

    /**
     * Query text listing a table's partitions.
     *
     * @param table partitioned table
     * @return SQL
     */
    String partitionQuery(TableRef table);

    Optional<String> viewDefinition(String databaseId, TableRef table) throws SQLException;
}
