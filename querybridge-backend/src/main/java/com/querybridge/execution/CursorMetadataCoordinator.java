package com.querybridge.execution;

import com.querybridge.cursor.CursorHandle;
import com.querybridge.model.QueryRecord;
import com.querybridge.model.QueryStatus;
import com.querybridge.service.QueryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Publishes what a running cursor knows about its remote query onto the query record and
 * acts on a stop that was requested before the remote query id existed.
 */
@Slf4j
@Component
public class CursorMetadataCoordinator {

    private final QueryStore queryStore;
    private final CancellationController cancellationController;
    private final String trackingPathTemplate;

    public CursorMetadataCoordinator(
            QueryStore queryStore,
            CancellationController cancellationController,
            @Value("${querybridge.tracking.path-template:/ui/query.html?{queryId}}") String trackingPathTemplate
    ) {
        this.queryStore = queryStore;
        this.cancellationController = cancellationController;
        this.trackingPathTemplate = trackingPathTemplate;
    }

    /**
     * Record the remote query id and tracking URL, then honour a pending early cancel.
     * Runs on the calling thread while the cursor may still be executing.
     *
     * @param cursor executing cursor; only its id and connection metadata are read
     * @param query query record
     */
    public void handleCursor(CursorHandle cursor, QueryRecord query) {
        String cancelQueryId = cursor.getQueryId();
        log.debug("Query {}: queryId {} found in cursor", query.getId(), cancelQueryId);

        if (hasText(cancelQueryId)) {
            query.setExtraJsonKey(QueryRecord.CANCEL_QUERY_KEY, cancelQueryId);
        }
        resolveTrackingUrl(cursor).ifPresent(query::setTrackingUrl);

        queryStore.save(query);

        // The cancel id is stored before the flag is read: a stop arriving after this point
        // sees the id and cancels directly instead of raising the flag.
        if (hasText(cancelQueryId) && query.isExtraFlagSet(QueryRecord.EARLY_CANCEL_KEY)) {
            log.info("Query {}: executing deferred cancellation of remote query {}", query.getId(), cancelQueryId);
            query.removeExtraKey(QueryRecord.EARLY_CANCEL_KEY);
            if (cancellationController.cancelWithFreshCursor(query, cancelQueryId)) {
                query.setStatus(QueryStatus.STOPPED);
            }
            queryStore.save(query);
        }
    }

    /**
     * Prefer the driver's own info URI, else build one from the coordinator address.
     *
     * @param cursor cursor
     * @return tracking URL, empty if neither source is available
     */
    public Optional<String> resolveTrackingUrl(CursorHandle cursor) {
        Optional<String> infoUri = cursor.getInfoUri();
        if (infoUri.isPresent()) {
            return infoUri;
        }
        String queryId = cursor.getQueryId();
        if (!hasText(queryId)) {
            return Optional.empty();
        }
        return cursor.getConnectionMetadata()
                .map(metadata -> metadata.baseUrl() + trackingPathTemplate.replace("{queryId}", queryId));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
