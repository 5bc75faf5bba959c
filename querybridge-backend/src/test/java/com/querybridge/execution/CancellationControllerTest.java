package com.querybridge.execution;

import com.querybridge.cursor.CursorFactory;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.model.QueryRecord;
import com.querybridge.service.QueryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CancellationControllerTest {

    private static final String KILL_Q1 =
            "CALL system.runtime.kill_query(query_id => 'q-1', message => 'Query cancelled by QueryBridge')";

    @Mock
    private CursorFactory cursorFactory;

    @Mock
    private QueryStore queryStore;

    @Mock
    private CursorHandle cursor;

    private CancellationController controller;
    private QueryRecord query;

    @BeforeEach
    public void setup() {
        controller = new CancellationController(cursorFactory, queryStore, "Query cancelled by QueryBridge");
        query = new QueryRecord("query-1", "db-1", "SELECT 1");
    }

    @Test
    public void cancel_killAccepted_returnsTrue() throws Exception {
        when(cursor.drain()).thenReturn(1L);

        assertTrue(controller.cancel(cursor, query, "q-1"));

        verify(cursor).execute(KILL_Q1);
        verify(cursor).drain();
    }

    @Test
    public void cancel_queryAlreadyFinished_returnsFalseEveryTime() throws Exception {
        doThrow(new SQLException("Query not found: q-1")).when(cursor).execute(anyString());

        assertFalse(controller.cancel(cursor, query, "q-1"));
        assertFalse(controller.cancel(cursor, query, "q-1"));
        verify(cursor, never()).drain();
    }

    @Test
    public void cancel_consumingResultFails_returnsFalse() throws Exception {
        when(cursor.drain()).thenThrow(new SQLException("Access Denied: Cannot kill query"));

        assertFalse(controller.cancel(cursor, query, "q-1"));
    }

    @Test
    public void buildKillStatement_escapesQuotes() {
        CancellationController quoting = new CancellationController(cursorFactory, queryStore, "user's stop");

        assertEquals("CALL system.runtime.kill_query(query_id => 'q''1', message => 'user''s stop')",
                quoting.buildKillStatement("q'1"));
    }

    @Test
    public void requestCancel_idUnknown_raisesAndPersistsFlag() {
        Optional<String> known = controller.requestCancel(query);

        assertTrue(known.isEmpty());
        assertTrue(query.isExtraFlagSet(QueryRecord.EARLY_CANCEL_KEY));
        verify(queryStore).save(query);
    }

    @Test
    public void requestCancel_idKnown_returnsIdWithoutFlag() {
        query.setExtraJsonKey(QueryRecord.CANCEL_QUERY_KEY, "q-1");

        assertEquals(Optional.of("q-1"), controller.requestCancel(query));
        assertFalse(query.hasExtraKey(QueryRecord.EARLY_CANCEL_KEY));
        verifyNoInteractions(queryStore);
    }

    @Test
    public void cancelWithFreshCursor_closesCursor() throws Exception {
        when(cursorFactory.newCursor("db-1")).thenReturn(cursor);

        assertTrue(controller.cancelWithFreshCursor(query, "q-1"));

        verify(cursor).execute(KILL_Q1);
        verify(cursor).close();
    }

    @Test
    public void cancelWithFreshCursor_cannotConnect_returnsFalse() throws Exception {
        when(cursorFactory.newCursor("db-1")).thenThrow(new SQLException("Connection refused"));

        assertFalse(controller.cancelWithFreshCursor(query, "q-1"));
    }
}
