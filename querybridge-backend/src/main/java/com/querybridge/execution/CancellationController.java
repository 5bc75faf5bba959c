package com.querybridge.execution;

import com.querybridge.cursor.CursorFactory;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.model.QueryRecord;
import com.querybridge.service.QueryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Issues remote cancellation for running queries.
 *
 * <p>Cancellation is best-effort: failures are logged and reported as {@code false}, never
 * thrown.
 */
@Slf4j
@Component
public class CancellationController {

    private final CursorFactory cursorFactory;
    private final QueryStore queryStore;
    private final String cancelMessage;

    public CancellationController(
            CursorFactory cursorFactory,
            QueryStore queryStore,
            @Value("${querybridge.cancel.message:Query cancelled by QueryBridge}") String cancelMessage
    ) {
        this.cursorFactory = cursorFactory;
        this.queryStore = queryStore;
        this.cancelMessage = cancelMessage;
    }

    /**
     * Record a stop request. When the remote query id is not known yet the early-cancel flag
     * is raised and persisted, and the cursor coordinator cancels once the id appears.
     *
     * @param query query record
     * @return the remote query id when it is already known; the caller cancels it directly
     */
    public Optional<String> requestCancel(QueryRecord query) {
        synchronized (query) {
            String cancelQueryId = query.getCancelQueryId();
            if (cancelQueryId != null) {
                return Optional.of(cancelQueryId);
            }
            query.setExtraJsonKey(QueryRecord.EARLY_CANCEL_KEY, true);
        }
        queryStore.save(query);
        log.info("Query {}: stop requested before a remote query id was assigned", query.getId());
        return Optional.empty();
    }

    /**
     * Kill a remote query using a cursor that is not the one blocked in execution.
     *
     * @param cursor fresh cursor on the query's database
     * @param query query record
     * @param cancelQueryId remote query id
     * @return true if the kill command was accepted
     */
    public boolean cancel(CursorHandle cursor, QueryRecord query, String cancelQueryId) {
        try {
            cursor.execute(buildKillStatement(cancelQueryId));
            // The call only takes effect once its result is consumed.
            cursor.drain();
        } catch (Exception e) {
            log.warn("Query {}: cancellation of remote query {} did not succeed: {}",
                    query.getId(), cancelQueryId, e.getMessage());
            return false;
        }
        log.info("Query {}: remote query {} cancelled", query.getId(), cancelQueryId);
        return true;
    }

    /**
     * Open a new cursor on the query's database, cancel and close it.
     *
     * @param query query record
     * @param cancelQueryId remote query id
     * @return true if the kill command was accepted
     */
    public boolean cancelWithFreshCursor(QueryRecord query, String cancelQueryId) {
        CursorHandle cursor;
        try {
            cursor = cursorFactory.newCursor(query.getDatabaseId());
        } catch (SQLException | RuntimeException e) {
            log.warn("Query {}: could not open a cursor to cancel remote query {}: {}",
                    query.getId(), cancelQueryId, e.getMessage());
            return false;
        }

        try {
            return cancel(cursor, query, cancelQueryId);
        } finally {
            try {
                cursor.close();
            } catch (SQLException e) {
                log.debug("Query {}: failed to close cancel cursor", query.getId(), e);
            }
        }
    }

    String buildKillStatement(String cancelQueryId) {
        return "CALL system.runtime.kill_query(query_id => '" + escapeLiteral(cancelQueryId) + "', "
                + "message => '" + escapeLiteral(cancelMessage) + "')";
    }

    private static String escapeLiteral(String value) {
        return value == null ? "" : value.replace("'", "''");
    }
}
