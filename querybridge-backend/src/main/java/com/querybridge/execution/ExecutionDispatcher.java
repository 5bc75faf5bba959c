package com.querybridge.execution;

import com.querybridge.context.ContextPropagator;
import com.querybridge.context.RequestContext;
import com.querybridge.cursor.CursorHandle;
import com.querybridge.error.ErrorKind;
import com.querybridge.error.ExceptionTaxonomyMapper;
import com.querybridge.error.QueryExecutionException;
import com.querybridge.model.QueryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a blocking cursor execution on a worker thread so the remote query id can be picked
 * up while the statement is still running.
 *
 * <p>The caller waits for the id (or for the worker to finish), hands the cursor to
 * {@link CursorMetadataCoordinator}, then blocks until the worker completes, even when the
 * hand-off itself fails. No timeout is applied to the remote execution.
 */
@Slf4j
@Component
public class ExecutionDispatcher {

    private final ExecutorService workers;
    private final CursorMetadataCoordinator coordinator;
    private final ExceptionTaxonomyMapper exceptionMapper;
    private final ContextPropagator contextPropagator;
    private final long startGracePeriodMs;
    private final long pollIntervalMs;

    public ExecutionDispatcher(
            @Qualifier("queryExecutionWorkers") ExecutorService workers,
            CursorMetadataCoordinator coordinator,
            ExceptionTaxonomyMapper exceptionMapper,
            ContextPropagator contextPropagator,
            @Value("${querybridge.execution.start-grace-period-ms:100}") long startGracePeriodMs,
            @Value("${querybridge.execution.poll-interval-ms:100}") long pollIntervalMs
    ) {
        this.workers = workers;
        this.coordinator = coordinator;
        this.exceptionMapper = exceptionMapper;
        this.contextPropagator = contextPropagator;
        this.startGracePeriodMs = startGracePeriodMs;
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
    }

    /**
     * Execute a statement and handle the resulting cursor.
     *
     * @param cursor cursor owned by this call for the duration of the execution
     * @param sql statement
     * @param query query record
     * @throws QueryExecutionException if the remote execution fails
     */
    public void executeWithCursor(CursorHandle cursor, String sql, QueryRecord query) {
        String queryId = query.getId();
        RequestContext context = contextPropagator.capture();

        AtomicReference<Throwable> executeError = new AtomicReference<>();
        CountDownLatch executeCompleted = new CountDownLatch(1);

        workers.execute(() -> {
            try (RequestContext.Scope ignored = contextPropagator.restore(context)) {
                log.debug("Query {}: Running query: {}", queryId, sql);
                cursor.execute(sql);
            } catch (Throwable t) {
                executeError.set(t);
            } finally {
                executeCompleted.countDown();
            }
        });

        RuntimeException handoffFailure = null;
        try {
            waitForQueryId(cursor, executeCompleted, queryId);
            log.debug("Query {}: Handling cursor", queryId);
            coordinator.handleCursor(cursor, query);
        } catch (RuntimeException e) {
            handoffFailure = e;
        } finally {
            // The worker owns the cursor until execute returns, whatever happened above.
            log.debug("Query {}: Waiting for query to complete", queryId);
            awaitCompletion(executeCompleted, queryId);
        }

        Throwable error = executeError.get();
        if (handoffFailure != null) {
            if (error != null) {
                handoffFailure.addSuppressed(error);
            }
            throw handoffFailure;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        if (error != null) {
            QueryExecutionException mapped = exceptionMapper.translate(error);
            log.debug("Query {}: execution failed as {}: {}", queryId, mapped.getKind(), mapped.getMessage());
            throw mapped;
        }
    }

    private void waitForQueryId(CursorHandle cursor, CountDownLatch executeCompleted, String queryId) {
        try {
            // Give the worker a chance to submit the statement before polling for its id.
            TimeUnit.MILLISECONDS.sleep(startGracePeriodMs);
            // The id may never appear if execution fails first.
            while (!hasText(cursor.getQueryId()) && executeCompleted.getCount() > 0) {
                executeCompleted.await(pollIntervalMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(ErrorKind.UNKNOWN_ERROR,
                    "Interrupted while waiting for query " + queryId + " to start", e);
        }
    }

    private void awaitCompletion(CountDownLatch executeCompleted, String queryId) {
        boolean interrupted = false;
        while (true) {
            try {
                executeCompleted.await();
                break;
            } catch (InterruptedException e) {
                // The remote query keeps running; keep waiting so the cursor is not released early.
                interrupted = true;
                log.warn("Query {}: interrupted while waiting for completion, still waiting", queryId);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
