package com.querybridge.execution;

import com.querybridge.cursor.ConnectionMetadata;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.model.QueryRecord;
import com.querybridge.model.QueryStatus;
import com.querybridge.service.QueryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CursorMetadataCoordinatorTest {

    @Mock
    private QueryStore queryStore;

    @Mock
    private CancellationController cancellationController;

    @Mock
    private CursorHandle cursor;

    private CursorMetadataCoordinator coordinator;
    private QueryRecord query;

    @BeforeEach
    public void setup() {
        coordinator = new CursorMetadataCoordinator(queryStore, cancellationController, "/ui/query.html?{queryId}");
        query = new QueryRecord("query-1", "db-1", "SELECT 1");
    }

    @Test
    public void handleCursor_idAndInfoUri_recordedAndSaved() {
        when(cursor.getQueryId()).thenReturn("q-1");
        when(cursor.getInfoUri()).thenReturn(Optional.of("https://trino.example.com/ui/query.html?q-1&x=1"));

        coordinator.handleCursor(cursor, query);

        assertEquals("q-1", query.getCancelQueryId());
        assertEquals("https://trino.example.com/ui/query.html?q-1&x=1", query.getTrackingUrl());
        verify(queryStore).save(query);
        verifyNoInteractions(cancellationController);
    }

    @Test
    public void handleCursor_noInfoUri_synthesizesFromCoordinatorAddress() {
        when(cursor.getQueryId()).thenReturn("q-1");
        when(cursor.getInfoUri()).thenReturn(Optional.empty());
        when(cursor.getConnectionMetadata())
                .thenReturn(Optional.of(new ConnectionMetadata("https", "trino.example.com", 8443)));

        coordinator.handleCursor(cursor, query);

        assertEquals("https://trino.example.com:8443/ui/query.html?q-1", query.getTrackingUrl());
    }

    @Test
    public void handleCursor_noIdYet_savesWithoutIdOrUrl() {
        when(cursor.getQueryId()).thenReturn(null);
        when(cursor.getInfoUri()).thenReturn(Optional.empty());

        coordinator.handleCursor(cursor, query);

        assertFalse(query.hasExtraKey(QueryRecord.CANCEL_QUERY_KEY));
        assertNull(query.getTrackingUrl());
        verify(queryStore).save(query);
    }

    @Test
    public void handleCursor_earlyCancelPending_cancelsOnceAndClearsFlag() {
        query.setStatus(QueryStatus.RUNNING);
        query.setExtraJsonKey(QueryRecord.EARLY_CANCEL_KEY, true);
        when(cursor.getQueryId()).thenReturn("q-2");
        when(cursor.getInfoUri()).thenReturn(Optional.empty());
        when(cursor.getConnectionMetadata()).thenReturn(Optional.empty());
        when(cancellationController.cancelWithFreshCursor(query, "q-2")).thenReturn(true);

        coordinator.handleCursor(cursor, query);

        verify(cancellationController, times(1)).cancelWithFreshCursor(query, "q-2");
        assertFalse(query.hasExtraKey(QueryRecord.EARLY_CANCEL_KEY));
        assertEquals("q-2", query.getCancelQueryId());
        assertEquals(QueryStatus.STOPPED, query.getStatus());
        verify(queryStore, times(2)).save(query);
    }

    @Test
    public void handleCursor_deferredKillRejected_statusUnchanged() {
        query.setStatus(QueryStatus.RUNNING);
        query.setExtraJsonKey(QueryRecord.EARLY_CANCEL_KEY, true);
        when(cursor.getQueryId()).thenReturn("q-3");
        when(cursor.getInfoUri()).thenReturn(Optional.empty());
        when(cursor.getConnectionMetadata()).thenReturn(Optional.empty());
        when(cancellationController.cancelWithFreshCursor(query, "q-3")).thenReturn(false);

        coordinator.handleCursor(cursor, query);

        assertEquals(QueryStatus.RUNNING, query.getStatus());
        assertFalse(query.hasExtraKey(QueryRecord.EARLY_CANCEL_KEY));
        verify(queryStore, times(2)).save(query);
    }

    @Test
    public void handleCursor_earlyCancelPendingWithoutId_leavesFlag() {
        query.setExtraJsonKey(QueryRecord.EARLY_CANCEL_KEY, true);
        when(cursor.getQueryId()).thenReturn("");
        when(cursor.getInfoUri()).thenReturn(Optional.empty());

        coordinator.handleCursor(cursor, query);

        verify(cancellationController, never()).cancelWithFreshCursor(any(), anyString());
        assertTrue(query.isExtraFlagSet(QueryRecord.EARLY_CANCEL_KEY));
    }
}
