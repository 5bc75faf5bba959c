package com.querybridge.controller;

import com.querybridge.api.ColumnsResponse;
import com.querybridge.api.DatabaseRegisterRequest;
import com.querybridge.api.DatabaseResponse;
import com.querybridge.api.IndexesResponse;
import com.querybridge.api.QueryResponse;
import com.querybridge.api.QuerySubmitRequest;
import com.querybridge.api.StopQueryResponse;
import com.querybridge.api.TableMetadataResponse;
import com.querybridge.cursor.JdbcCursorFactory;
import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.DatabaseInfo;
import com.querybridge.model.QueryRecord;
import com.querybridge.model.TableMetadata;
import com.querybridge.model.TableRef;
import com.querybridge.schema.ColumnService;
import com.querybridge.schema.TableMetadataService;
import com.querybridge.service.DatabaseNotFoundException;
import com.querybridge.service.DatabaseRegistry;
import com.querybridge.service.QueryExecutionService;
import com.querybridge.service.StopOutcome;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class QueryBridgeController {

    private static final Logger log = LoggerFactory.getLogger(QueryBridgeController.class);
    private static final String TRACE_ID = "trace_id";

    private final DatabaseRegistry databaseRegistry;
    private final JdbcCursorFactory jdbcCursorFactory;
    private final QueryExecutionService queryExecutionService;
    private final ColumnService columnService;
    private final TableMetadataService tableMetadataService;

    public QueryBridgeController(
            DatabaseRegistry databaseRegistry,
            JdbcCursorFactory jdbcCursorFactory,
            QueryExecutionService queryExecutionService,
            ColumnService columnService,
            TableMetadataService tableMetadataService
    ) {
        this.databaseRegistry = databaseRegistry;
        this.jdbcCursorFactory = jdbcCursorFactory;
        this.queryExecutionService = queryExecutionService;
        this.columnService = columnService;
        this.tableMetadataService = tableMetadataService;
    }

    /**
     * Register a remote database.
     *
     * POST /v1/databases
     *
     * @param request JDBC URL, credentials and options
     * @return registered database
     */
    @PostMapping("/databases")
    public ResponseEntity<DatabaseResponse> registerDatabase(@Valid @RequestBody DatabaseRegisterRequest request) {
        DatabaseInfo database = databaseRegistry.register(request);
        log.info("Database registered: database_id={}, name={}", database.getDatabaseId(), database.getName());
        return ResponseEntity.ok(DatabaseResponse.from(database, MDC.get(TRACE_ID)));
    }

    @GetMapping("/databases")
    public ResponseEntity<List<DatabaseResponse>> listDatabases() {
        String traceId = MDC.get(TRACE_ID);
        return ResponseEntity.ok(databaseRegistry.listDatabases().stream()
                .map(database -> DatabaseResponse.from(database, traceId))
                .toList());
    }

    /**
     * Remove a database and close its connection pool.
     *
     * DELETE /v1/databases/{id}
     */
    @DeleteMapping("/databases/{id}")
    public ResponseEntity<Void> removeDatabase(@PathVariable("id") String databaseId) {
        if (!databaseRegistry.removeDatabase(databaseId)) {
            throw new DatabaseNotFoundException("Database not found: " + databaseId);
        }
        jdbcCursorFactory.closeDatabase(databaseId);
        log.info("Database removed: database_id={}", databaseId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Describe a table's columns.
     *
     * GET /v1/databases/{id}/columns?schema=..&amp;table=..&amp;expand_rows=true
     *
     * @return columns, with nested row fields when expansion is enabled
     */
    @GetMapping("/databases/{id}/columns")
    public ResponseEntity<ColumnsResponse> describeColumns(
            @PathVariable("id") String databaseId,
            @RequestParam(value = "catalog", required = false) String catalog,
            @RequestParam(value = "schema", required = false) String schema,
            @RequestParam("table") String table,
            @RequestParam(value = "expand_rows", required = false) Boolean expandRows
    ) {
        TableRef tableRef = new TableRef(catalog, schema, table);
        List<ColumnDescriptor> columns = columnService.getColumns(databaseId, tableRef, expandRows);
        boolean expanded = expandRows != null ? expandRows : databaseRegistry.requireDatabase(databaseId).isExpandRows();
        return ResponseEntity.ok(ColumnsResponse.builder()
                .databaseId(databaseId)
                .schema(schema)
                .table(table)
                .expandRows(expanded)
                .columns(columns)
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    @GetMapping("/databases/{id}/indexes")
    public ResponseEntity<IndexesResponse> describeIndexes(
            @PathVariable("id") String databaseId,
            @RequestParam(value = "catalog", required = false) String catalog,
            @RequestParam(value = "schema", required = false) String schema,
            @RequestParam("table") String table
    ) {
        return ResponseEntity.ok(IndexesResponse.builder()
                .databaseId(databaseId)
                .schema(schema)
                .table(table)
                .indexes(tableMetadataService.getIndexes(databaseId, new TableRef(catalog, schema, table)))
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * Partitioning and view details of a table.
     *
     * GET /v1/databases/{id}/metadata?schema=..&amp;table=..
     */
    @GetMapping("/databases/{id}/metadata")
    public ResponseEntity<TableMetadataResponse> describeTableMetadata(
            @PathVariable("id") String databaseId,
            @RequestParam(value = "catalog", required = false) String catalog,
            @RequestParam(value = "schema", required = false) String schema,
            @RequestParam("table") String table
    ) {
        TableMetadata metadata = tableMetadataService.getExtraTableMetadata(databaseId, new TableRef(catalog, schema, table));
        return ResponseEntity.ok(TableMetadataResponse.from(databaseId, schema, table, metadata, MDC.get(TRACE_ID)));
    }

    /**
     * Execute a statement; returns once the remote query has finished.
     *
     * POST /v1/queries
     */
    @PostMapping("/queries")
    public ResponseEntity<QueryResponse> submitQuery(@Valid @RequestBody QuerySubmitRequest request) {
        QueryRecord query = queryExecutionService.submit(request.getDatabaseId(), request.getSql(), request.getQueryId());
        return ResponseEntity.ok(QueryResponse.from(query, MDC.get(TRACE_ID)));
    }

    @GetMapping("/queries/{id}")
    public ResponseEntity<QueryResponse> getQuery(@PathVariable("id") String queryId) {
        return ResponseEntity.ok(QueryResponse.from(queryExecutionService.getQuery(queryId), MDC.get(TRACE_ID)));
    }

    /**
     * Stop a running query.
     *
     * POST /v1/queries/{id}/stop
     *
     * @return outcome; a query that cannot be cancelled is reported, not failed
     */
    @PostMapping("/queries/{id}/stop")
    public ResponseEntity<StopQueryResponse> stopQuery(@PathVariable("id") String queryId) {
        log.info("Stop requested: query_id={}, trace_id={}", queryId, MDC.get(TRACE_ID));
        StopOutcome outcome = queryExecutionService.stop(queryId);
        return ResponseEntity.ok(StopQueryResponse.builder()
                .queryId(queryId)
                .outcome(outcome.name())
                .cancelled(outcome == StopOutcome.CANCELLED)
                .traceId(MDC.get(TRACE_ID))
                .build());
    }
}
