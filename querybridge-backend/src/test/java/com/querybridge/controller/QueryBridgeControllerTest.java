package com.querybridge.controller;

import com.querybridge.api.DatabaseRegisterRequest;
import com.querybridge.cursor.JdbcCursorFactory;
import com.querybridge.error.ErrorKind;
import com.querybridge.error.QueryExecutionException;
import com.querybridge.model.ColumnDescriptor;
import com.querybridge.model.DatabaseInfo;
import com.querybridge.model.IndexDescriptor;
import com.querybridge.model.PartitionMetadata;
import com.querybridge.model.QueryRecord;
import com.querybridge.model.QueryStatus;
import com.querybridge.model.TableMetadata;
import com.querybridge.model.TableRef;
import com.querybridge.schema.ColumnService;
import com.querybridge.schema.NoSuchTableException;
import com.querybridge.schema.TableMetadataService;
import com.querybridge.service.DatabaseRegistry;
import com.querybridge.service.QueryExecutionService;
import com.querybridge.service.QueryNotFoundException;
import com.querybridge.service.StopOutcome;
import com.querybridge.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryBridgeControllerTest {

    @Mock
    private DatabaseRegistry databaseRegistry;

    @Mock
    private JdbcCursorFactory jdbcCursorFactory;

    @Mock
    private QueryExecutionService queryExecutionService;

    @Mock
    private ColumnService columnService;

    @Mock
    private TableMetadataService tableMetadataService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setup() {
        QueryBridgeController controller =
                new QueryBridgeController(databaseRegistry, jdbcCursorFactory, queryExecutionService,
                        columnService, tableMetadataService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void registerDatabase_valid_returnsId() throws Exception {
        when(databaseRegistry.register(any(DatabaseRegisterRequest.class))).thenReturn(DatabaseInfo.builder()
                .databaseId("db-1")
                .name("warehouse")
                .jdbcUrl("jdbc:trino://localhost:8080/hive")
                .expandRows(true)
                .registeredAt(OffsetDateTime.now())
                .build());

        mockMvc.perform(post("/v1/databases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"warehouse\",\"jdbc_url\":\"jdbc:trino://localhost:8080/hive\",\"expand_rows\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database_id").value("db-1"))
                .andExpect(jsonPath("$.expand_rows").value(true));
    }

    @Test
    public void registerDatabase_badUrl_validationFailed() throws Exception {
        mockMvc.perform(post("/v1/databases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"warehouse\",\"jdbc_url\":\"trino://localhost\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(databaseRegistry);
    }

    @Test
    public void listDatabases_returnsRegistered() throws Exception {
        when(databaseRegistry.listDatabases()).thenReturn(List.of(DatabaseInfo.builder()
                .databaseId("db-1")
                .name("warehouse")
                .jdbcUrl("jdbc:trino://localhost:8080/hive")
                .password("secret")
                .registeredAt(OffsetDateTime.now())
                .build()));

        mockMvc.perform(get("/v1/databases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].database_id").value("db-1"))
                .andExpect(jsonPath("$[0].password").doesNotExist());
    }

    @Test
    public void removeDatabase_closesPool() throws Exception {
        when(databaseRegistry.removeDatabase("db-1")).thenReturn(true);

        mockMvc.perform(delete("/v1/databases/db-1"))
                .andExpect(status().isNoContent());

        verify(jdbcCursorFactory).closeDatabase("db-1");
    }

    @Test
    public void removeDatabase_unknown_notFound() throws Exception {
        when(databaseRegistry.removeDatabase("nope")).thenReturn(false);

        mockMvc.perform(delete("/v1/databases/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        verifyNoInteractions(jdbcCursorFactory);
    }

    @Test
    public void describeColumns_expanded_returnsQueryAs() throws Exception {
        ColumnDescriptor city = ColumnDescriptor.builder()
                .name("addr.city")
                .columnName("addr.city")
                .declaredType("varchar")
                .queryAs("\"addr\".\"city\" AS \"addr.city\"")
                .build();
        when(columnService.getColumns("db-1", new TableRef(null, "sales", "orders"), true)).thenReturn(List.of(city));

        mockMvc.perform(get("/v1/databases/db-1/columns")
                        .param("schema", "sales")
                        .param("table", "orders")
                        .param("expand_rows", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expand_rows").value(true))
                .andExpect(jsonPath("$.columns[0].name").value("addr.city"))
                .andExpect(jsonPath("$.columns[0].query_as").value("\"addr\".\"city\" AS \"addr.city\""));
    }

    @Test
    public void describeColumns_missingTable_notFound() throws Exception {
        TableRef ref = new TableRef(null, "sales", "missing");
        when(columnService.getColumns("db-1", ref, false)).thenThrow(new NoSuchTableException(ref));

        mockMvc.perform(get("/v1/databases/db-1/columns")
                        .param("schema", "sales")
                        .param("table", "missing")
                        .param("expand_rows", "false"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No such table: sales.missing"));
    }

    @Test
    public void describeIndexes_partitioned_returnsPartitionIndex() throws Exception {
        when(tableMetadataService.getIndexes("db-1", new TableRef(null, "sales", "orders"))).thenReturn(List.of(
                IndexDescriptor.builder().name("partition").columnNames(List.of("ds")).unique(false).build()));

        mockMvc.perform(get("/v1/databases/db-1/indexes")
                        .param("schema", "sales")
                        .param("table", "orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.indexes[0].name").value("partition"))
                .andExpect(jsonPath("$.indexes[0].column_names[0]").value("ds"))
                .andExpect(jsonPath("$.indexes[0].unique").value(false));
    }

    @Test
    public void describeTableMetadata_partitioned_returnsPartitions() throws Exception {
        when(tableMetadataService.getExtraTableMetadata("db-1", new TableRef(null, "sales", "orders")))
                .thenReturn(TableMetadata.builder()
                        .partitions(PartitionMetadata.builder()
                                .cols(List.of("ds"))
                                .latest(Map.of("ds", "2024-01-02"))
                                .partitionQuery("SELECT * FROM \"sales\".\"orders$partitions\"")
                                .build())
                        .build());

        mockMvc.perform(get("/v1/databases/db-1/metadata")
                        .param("schema", "sales")
                        .param("table", "orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.partitions.cols[0]").value("ds"))
                .andExpect(jsonPath("$.partitions.latest.ds").value("2024-01-02"))
                .andExpect(jsonPath("$.partitions.partition_query").value("SELECT * FROM \"sales\".\"orders$partitions\""))
                .andExpect(jsonPath("$.view").doesNotExist());
    }

    @Test
    public void describeTableMetadata_view_returnsDefinition() throws Exception {
        when(tableMetadataService.getExtraTableMetadata("db-1", new TableRef(null, "sales", "v_orders")))
                .thenReturn(TableMetadata.builder().view("SELECT * FROM sales.raw_orders").build());

        mockMvc.perform(get("/v1/databases/db-1/metadata")
                        .param("schema", "sales")
                        .param("table", "v_orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.view").value("SELECT * FROM sales.raw_orders"))
                .andExpect(jsonPath("$.partitions").doesNotExist());
    }

    @Test
    public void submitQuery_success_returnsRecord() throws Exception {
        QueryRecord query = new QueryRecord("client-1", "db-1", "SELECT 1");
        query.setStatus(QueryStatus.SUCCESS);
        query.setExtraJsonKey(QueryRecord.CANCEL_QUERY_KEY, "q-1");
        query.setTrackingUrl("http://localhost:8080/ui/query.html?q-1");
        when(queryExecutionService.submit("db-1", "SELECT 1", "client-1")).thenReturn(query);

        mockMvc.perform(post("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"database_id\":\"db-1\",\"sql\":\"SELECT 1\",\"query_id\":\"client-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query_id").value("client-1"))
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.cancel_query_id").value("q-1"))
                .andExpect(jsonPath("$.tracking_url").value("http://localhost:8080/ui/query.html?q-1"));
    }

    @Test
    public void submitQuery_programmingError_badRequest() throws Exception {
        when(queryExecutionService.submit(eq("db-1"), eq("SELEC 1"), any()))
                .thenThrow(new QueryExecutionException(ErrorKind.PROGRAMMING_ERROR, "mismatched input 'SELEC'", null));

        mockMvc.perform(post("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"database_id\":\"db-1\",\"sql\":\"SELEC 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PROGRAMMING_ERROR"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.message").value("mismatched input 'SELEC'"));
    }

    @Test
    public void submitQuery_connectionError_badGateway() throws Exception {
        when(queryExecutionService.submit(eq("db-1"), eq("SELECT 1"), any()))
                .thenThrow(new QueryExecutionException(ErrorKind.CONNECTION_ERROR, "Connection refused", null));

        mockMvc.perform(post("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"database_id\":\"db-1\",\"sql\":\"SELECT 1\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("CONNECTION_ERROR"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    public void getQuery_unknown_notFound() throws Exception {
        when(queryExecutionService.getQuery("missing")).thenThrow(new QueryNotFoundException("Query not found: missing"));

        mockMvc.perform(get("/v1/queries/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.retryable").doesNotExist());
    }

    @Test
    public void stopQuery_deferred_reportsNotYetCancelled() throws Exception {
        when(queryExecutionService.stop("client-1")).thenReturn(StopOutcome.DEFERRED);

        mockMvc.perform(post("/v1/queries/client-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("DEFERRED"))
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    public void stopQuery_killAccepted_reportsCancelled() throws Exception {
        when(queryExecutionService.stop("client-1")).thenReturn(StopOutcome.CANCELLED);

        mockMvc.perform(post("/v1/queries/client-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    public void stopQuery_rejected_reportsNotCancelled() throws Exception {
        when(queryExecutionService.stop("client-1")).thenReturn(StopOutcome.NOT_CANCELLED);

        mockMvc.perform(post("/v1/queries/client-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(false));
    }
}
