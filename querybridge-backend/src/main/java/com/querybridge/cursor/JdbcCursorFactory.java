package com.querybridge.cursor;

import com.querybridge.context.RequestContext;
import com.querybridge.model.DatabaseInfo;
import com.querybridge.service.DatabaseNotFoundException;
import com.querybridge.service.DatabaseRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens {@link JdbcCursor}s from one Hikari pool per registered database. Databases that
 * impersonate the requesting user get one pool per user, whose Trino connections carry
 * that user as the session user.
 */
@Slf4j
@Component
public class JdbcCursorFactory implements CursorFactory {
    static final String TRINO_SESSION_USER_PROPERTY = "sessionUser";

    private final Map<PoolKey, HikariDataSource> dataSources = new ConcurrentHashMap<>();

    private final DatabaseRegistry databaseRegistry;
    private final int maximumPoolSize;
    private final int minimumIdle;

    public JdbcCursorFactory(
            DatabaseRegistry databaseRegistry,
            @Value("${querybridge.pool.maximum-size:5}") int maximumPoolSize,
            @Value("${querybridge.pool.minimum-idle:1}") int minimumIdle
    ) {
        this.databaseRegistry = databaseRegistry;
        this.maximumPoolSize = maximumPoolSize;
        this.minimumIdle = minimumIdle;
    }

    @Override
    public CursorHandle newCursor(String databaseId) throws SQLException {
        DatabaseInfo database = databaseRegistry.getDatabase(databaseId)
                .orElseThrow(() -> new DatabaseNotFoundException("Database not found: " + databaseId));

        String sessionUser = resolveSessionUser(database);
        Connection connection = getDataSource(database, sessionUser).getConnection();
        try {
            return new JdbcCursor(connection, ConnectionMetadata.fromJdbcUrl(database.getJdbcUrl()).orElse(null));
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Close the pool of a database that has been removed.
     *
     * @param databaseId database id
     */
    public void closeDatabase(String databaseId) {
        for (PoolKey key : new ArrayList<>(dataSources.keySet())) {
            if (!key.databaseId().equals(databaseId)) {
                continue;
            }
            HikariDataSource ds = dataSources.remove(key);
            if (ds != null) {
                ds.close();
                log.info("Closed connection pool: database_id={}, session_user={}", databaseId, key.sessionUser());
            }
        }
    }

    @PreDestroy
    public void closeAll() {
        for (PoolKey key : new ArrayList<>(dataSources.keySet())) {
            closeDatabase(key.databaseId());
        }
    }

    /**
     * The user to run as on behalf of the current request, taken from the logging context.
     *
     * @param database target database
     * @return user, or null to run as the database's configured user
     */
    String resolveSessionUser(DatabaseInfo database) {
        if (!database.isImpersonateUser() || !isTrino(database.getJdbcUrl())) {
            return null;
        }
        String user = MDC.get(RequestContext.USER_KEY);
        return user != null && !user.isBlank() ? user : null;
    }

    private HikariDataSource getDataSource(DatabaseInfo database, String sessionUser) {
        return dataSources.computeIfAbsent(new PoolKey(database.getDatabaseId(), sessionUser),
                key -> new HikariDataSource(buildHikariConfig(database, sessionUser)));
    }

    HikariConfig buildHikariConfig(DatabaseInfo database) {
        return buildHikariConfig(database, null);
    }

    HikariConfig buildHikariConfig(DatabaseInfo database, String sessionUser) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("Pool-" + database.getDatabaseId() + (sessionUser != null ? "-" + sessionUser : ""));
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(database.getJdbcUrl());
        config.setUsername(database.getUsername());
        config.setPassword(database.getPassword());
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setIdleTimeout(60000);
        // Trino JDBC requires a user.
        if (isTrino(database.getJdbcUrl())) {
            config.addDataSourceProperty("source", "querybridge");
            if (database.getUsername() == null || database.getUsername().isBlank()) {
                config.setUsername(System.getProperty("user.name", "querybridge"));
            }
            if (sessionUser != null) {
                config.addDataSourceProperty(TRINO_SESSION_USER_PROPERTY, sessionUser);
                config.setMinimumIdle(0);
            }
        }
        return config;
    }

    private static boolean isTrino(String jdbcUrl) {
        return jdbcUrl != null && jdbcUrl.startsWith("jdbc:trino:");
    }

    private record PoolKey(String databaseId, String sessionUser) {
    }
}
