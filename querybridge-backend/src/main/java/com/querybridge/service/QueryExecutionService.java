package com.querybridge.service;

import com.querybridge.cursor.CursorFactory;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.error.ExceptionTaxonomyMapper;
import com.querybridge.error.QueryExecutionException;
import com.querybridge.execution.CancellationController;
import com.querybridge.execution.ExecutionDispatcher;
import com.querybridge.model.QueryRecord;
import com.querybridge.model.QueryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Submits statements to registered databases and stops them on request.
 */
@Slf4j
@Service
public class QueryExecutionService {

    private final DatabaseRegistry databaseRegistry;
    private final QueryStore queryStore;
    private final CursorFactory cursorFactory;
    private final ExecutionDispatcher dispatcher;
    private final CancellationController cancellationController;
    private final ExceptionTaxonomyMapper exceptionMapper;

    public QueryExecutionService(
            DatabaseRegistry databaseRegistry,
            QueryStore queryStore,
            CursorFactory cursorFactory,
            ExecutionDispatcher dispatcher,
            CancellationController cancellationController,
            ExceptionTaxonomyMapper exceptionMapper
    ) {
        this.databaseRegistry = databaseRegistry;
        this.queryStore = queryStore;
        this.cursorFactory = cursorFactory;
        this.dispatcher = dispatcher;
        this.cancellationController = cancellationController;
        this.exceptionMapper = exceptionMapper;
    }

    /**
     * Run a statement to completion. Blocks the calling thread for the duration of the
     * remote query.
     *
     * @param databaseId registered database id
     * @param sql statement
     * @param clientQueryId caller-chosen query id, generated when blank
     * @return the finished query record
     * @throws QueryExecutionException if the remote execution fails; the record is saved first
     */
    public QueryRecord submit(String databaseId, String sql, String clientQueryId) {
        databaseRegistry.requireDatabase(databaseId);

        String queryId = clientQueryId != null && !clientQueryId.isBlank() ? clientQueryId : UUID.randomUUID().toString();
        QueryRecord query = new QueryRecord(queryId, databaseId, sql);
        query.setStatus(QueryStatus.RUNNING);
        if (!queryStore.create(query)) {
            throw new IllegalArgumentException("Query already exists: " + queryId);
        }
        log.info("Query {}: submitted to database_id={}", queryId, databaseId);

        QueryExecutionException failure = null;
        try (CursorHandle cursor = cursorFactory.newCursor(databaseId)) {
            dispatcher.executeWithCursor(cursor, sql, query);
            query.setRowCount(cursor.drain());
        } catch (QueryExecutionException e) {
            failure = e;
        } catch (SQLException e) {
            failure = exceptionMapper.translate(e);
        }

        query.setEndedAt(OffsetDateTime.now());
        if (failure != null) {
            if (query.getStatus() != QueryStatus.STOPPED) {
                query.setStatus(QueryStatus.FAILED);
            }
            query.setErrorKind(failure.getKind().name());
            query.setErrorMessage(failure.getMessage());
            queryStore.save(query);
            log.info("Query {}: finished with status={} error_kind={}", queryId, query.getStatus(), failure.getKind());
            throw failure;
        }

        if (query.getStatus() != QueryStatus.STOPPED) {
            query.setStatus(QueryStatus.SUCCESS);
        }
        queryStore.save(query);
        log.info("Query {}: finished with status={} rows={}", queryId, query.getStatus(), query.getRowCount());
        return query;
    }

    /**
     * Stop a running query. The kill is sent right away when the remote id is known,
     * otherwise it is deferred until the executing thread discovers the id, and the query
     * stays running until then.
     *
     * @param queryId query id
     * @return outcome; failures to cancel are reported, never thrown
     */
    public StopOutcome stop(String queryId) {
        QueryRecord query = queryStore.load(queryId);
        if (query.getStatus().isTerminal()) {
            log.info("Query {}: stop requested but query already {}", queryId, query.getStatus());
            return StopOutcome.ALREADY_FINISHED;
        }

        Optional<String> cancelQueryId = cancellationController.requestCancel(query);
        if (cancelQueryId.isEmpty()) {
            return StopOutcome.DEFERRED;
        }

        if (!cancellationController.cancelWithFreshCursor(query, cancelQueryId.get())) {
            return StopOutcome.NOT_CANCELLED;
        }
        markStopped(query);
        return StopOutcome.CANCELLED;
    }

    public QueryRecord getQuery(String queryId) {
        return queryStore.load(queryId);
    }

    private void markStopped(QueryRecord query) {
        query.setStatus(QueryStatus.STOPPED);
        queryStore.save(query);
    }
}
