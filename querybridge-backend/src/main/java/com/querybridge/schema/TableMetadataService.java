package com.querybridge.schema;

import com.querybridge.error.ExceptionTaxonomyMapper;
import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.IndexDescriptor;
import com.querybridge.model.PartitionMetadata;
import com.querybridge.model.TableMetadata;
import com.querybridge.model.TableRef;
import com.querybridge.service.DatabaseRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

@Slf4j
@Service
public class TableMetadataService {

    private final DatabaseRegistry databaseRegistry;
    private final SchemaInspector schemaInspector;
    private final ExceptionTaxonomyMapper exceptionMapper;

    public TableMetadataService(
            DatabaseRegistry databaseRegistry,
            SchemaInspector schemaInspector,
            ExceptionTaxonomyMapper exceptionMapper
    ) {
        this.databaseRegistry = databaseRegistry;
        this.schemaInspector = schemaInspector;
        this.exceptionMapper = exceptionMapper;
    }

    /**
     * List the table's indexes. Trino only reports the partition key, read from the
     * table's {@code $partitions} companion.
     *
     * @param databaseId registered database id
     * @param table table
     * @return indexes; empty when the table is not partitioned or has never held rows
     */
    public List<IndexDescriptor> getIndexes(String databaseId, TableRef table) {
        databaseRegistry.requireDatabase(databaseId);
        try {
            return describeIndexes(databaseId, table);
        } catch (SQLException e) {
            throw exceptionMapper.translate(e);
        }
    }

    /**
     * Partitioning and view details of a table.
     *
     * @param databaseId registered database id
     * @param table table
     * @return metadata; both parts null for a plain, unpartitioned table
     */
    public TableMetadata getExtraTableMetadata(String databaseId, TableRef table) {
        databaseRegistry.requireDatabase(databaseId);
        try {
            TableMetadata.TableMetadataBuilder metadata = TableMetadata.builder();

            List<IndexDescriptor> indexes = describeIndexes(databaseId, table);
            if (!indexes.isEmpty()) {
                metadata.partitions(describePartitions(databaseId, table, indexes));
            }
            schemaInspector.viewDefinition(databaseId, table).ifPresent(metadata::view);

            return metadata.build();
        } catch (SQLException e) {
            throw exceptionMapper.translate(e);
        }
    }

    private List<IndexDescriptor> describeIndexes(String databaseId, TableRef table) throws SQLException {
        List<ColumnDescriptor> partitionColumns;
        try {
            partitionColumns = schemaInspector.describeColumns(databaseId, CursorSchemaInspector.partitionsTable(table));
        } catch (NoSuchTableException e) {
            log.debug("No partitions table for {}, reporting no indexes", table);
            return List.of();
        }
        List<String> names = new ArrayList<>(partitionColumns.size());
        for (ColumnDescriptor column : partitionColumns) {
            names.add(column.getColumnName());
        }
        return List.of(IndexDescriptor.builder()
                .name(IndexDescriptor.PARTITION)
                .columnNames(names)
                .unique(false)
                .build());
    }

    private PartitionMetadata describePartitions(String databaseId, TableRef table, List<IndexDescriptor> indexes)
            throws SQLException {
        List<String> columnNames = new ArrayList<>();
        TreeSet<String> sortedColumns = new TreeSet<>();
        for (IndexDescriptor index : indexes) {
            if (IndexDescriptor.PARTITION.equals(index.getName())) {
                columnNames.addAll(index.getColumnNames());
                sortedColumns.addAll(index.getColumnNames());
            }
        }

        Optional<Map<String, Object>> latestPartition = schemaInspector.latestPartition(databaseId, table, columnNames);
        Map<String, Object> latest;
        if (latestPartition.isPresent()) {
            latest = latestPartition.get();
        } else {
            latest = new LinkedHashMap<>();
            for (String column : columnNames) {
                latest.put(column, null);
            }
        }

        return PartitionMetadata.builder()
                .cols(new ArrayList<>(sortedColumns))
                .latest(latest)
                .partitionQuery(schemaInspector.partitionQuery(table))
                .build();
    }
}
