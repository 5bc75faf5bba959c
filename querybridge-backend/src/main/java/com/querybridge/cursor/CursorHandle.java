package com.querybridge.cursor;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * A driver handle for one remote statement execution.
 *
 * <p>{@link #execute(String)} blocks until the remote statement completes. While it is blocked
 * on one thread, other threads may only call {@link #getQueryId()}, {@link #getInfoUri()} and
 * {@link #getConnectionMetadata()}.
 */
public interface CursorHandle extends AutoCloseable {

    /**
     * Server-assigned query id; empty until the driver has submitted the statement.
     *
     * @return query id or null
     */
    String getQueryId();

    void execute(String sql) throws SQLException;

    /**
     * Drain the buffered results of the last {@link #execute(String)}.
     *
     * @return rows, empty when the statement produced no result set
     */
    List<List<Object>> fetchAll() throws SQLException;

    /**
     * Consume the results of the last {@link #execute(String)} without keeping them.
     *
     * @return number of rows read, 0 when the statement produced no result set
     */
    long drain() throws SQLException;

    /**
     * Driver-provided monitoring URI for the running query, if the driver exposes one.
     *
     * @return info URI
     */
    Optional<String> getInfoUri();

    Optional<ConnectionMetadata> getConnectionMetadata();

    @Override
    void close() throws SQLException;
}
