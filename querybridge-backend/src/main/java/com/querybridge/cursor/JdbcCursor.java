package com.querybridge.cursor;

import io.trino.jdbc.TrinoResultSet;
import io.trino.jdbc.TrinoStatement;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CursorHandle} over a JDBC connection. With the Trino driver the query id is
 * published through the statement's progress monitor as soon as the coordinator accepts
 * the statement; other drivers never report one.
 */
@Slf4j
public class JdbcCursor implements CursorHandle {
    private final Connection connection;
    private final Statement statement;
    private final ConnectionMetadata connectionMetadata;

    private volatile String queryId;
    private ResultSet resultSet;

    /**
     * Create a cursor; takes ownership of the connection.
     *
     * @param connection JDBC connection
     * @param connectionMetadata coordinator address, may be null
     * @throws SQLException if the statement cannot be created
     */
    public JdbcCursor(Connection connection, ConnectionMetadata connectionMetadata) throws SQLException {
        this.connection = connection;
        this.statement = connection.createStatement();
        this.connectionMetadata = connectionMetadata;
        registerProgressMonitor();
    }

    private void registerProgressMonitor() throws SQLException {
        if (!statement.isWrapperFor(TrinoStatement.class)) {
            return;
        }
        statement.unwrap(TrinoStatement.class).setProgressMonitor(stats -> {
            if (queryId == null && stats.getQueryId() != null) {
                queryId = stats.getQueryId();
            }
        });
    }

    @Override
    public String getQueryId() {
        return queryId;
    }

    @Override
    public void execute(String sql) throws SQLException {
        closeResultSet();
        if (statement.execute(sql)) {
            resultSet = statement.getResultSet();
            if (queryId == null && resultSet != null && resultSet.isWrapperFor(TrinoResultSet.class)) {
                queryId = resultSet.unwrap(TrinoResultSet.class).getQueryId();
            }
        }
    }

    @Override
    public List<List<Object>> fetchAll() throws SQLException {
        List<List<Object>> rows = new ArrayList<>();
        if (resultSet == null) {
            return rows;
        }
        int columnCount = resultSet.getMetaData().getColumnCount();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(resultSet.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public long drain() throws SQLException {
        long count = 0;
        if (resultSet == null) {
            return count;
        }
        while (resultSet.next()) {
            count++;
        }
        return count;
    }

    @Override
    public Optional<String> getInfoUri() {
        // The JDBC driver does not expose the coordinator's info URI.
        return Optional.empty();
    }

    @Override
    public Optional<ConnectionMetadata> getConnectionMetadata() {
        return Optional.ofNullable(connectionMetadata);
    }

    @Override
    public void close() throws SQLException {
        try (Connection c = connection; Statement s = statement) {
            closeResultSet();
        }
    }

    private void closeResultSet() throws SQLException {
        if (resultSet != null) {
            ResultSet rs = resultSet;
            resultSet = null;
            rs.close();
        }
    }
}
