package com.querybridge.cursor;

import com.querybridge.model.DatabaseInfo;
import com.querybridge.service.DatabaseNotFoundException;
import com.querybridge.service.DatabaseRegistry;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCursorFactoryTest {

    private final JdbcCursorFactory factory = new JdbcCursorFactory(new DatabaseRegistry(), 3, 0);

    @AfterEach
    public void tearDown() {
        MDC.clear();
    }

    private static DatabaseInfo trino(boolean impersonateUser) {
        return DatabaseInfo.builder()
                .databaseId("db-3")
                .jdbcUrl("jdbc:trino://localhost:8080/hive")
                .username("service")
                .impersonateUser(impersonateUser)
                .build();
    }

    @Test
    public void newCursor_unknownDatabase_throws() {
        assertThrows(DatabaseNotFoundException.class, () -> factory.newCursor("missing"));
    }

    @Test
    public void buildHikariConfig_trinoWithoutUser_defaultsUserAndSource() {
        HikariConfig config = factory.buildHikariConfig(DatabaseInfo.builder()
                .databaseId("db-1")
                .jdbcUrl("jdbc:trino://localhost:8080/hive")
                .build());

        assertEquals("Pool-db-1", config.getPoolName());
        assertEquals(3, config.getMaximumPoolSize());
        assertEquals(0, config.getMinimumIdle());
        assertEquals("querybridge", config.getDataSourceProperties().getProperty("source"));
        assertNotNull(config.getUsername());
        assertEquals(HikariSqlExceptionOverride.class.getName(), config.getExceptionOverrideClassName());
    }

    @Test
    public void buildHikariConfig_explicitUser_kept() {
        HikariConfig config = factory.buildHikariConfig(DatabaseInfo.builder()
                .databaseId("db-2")
                .jdbcUrl("jdbc:trino://localhost:8080/hive")
                .username("analyst")
                .build());

        assertEquals("analyst", config.getUsername());
    }

    @Test
    public void resolveSessionUser_impersonatingWithRequestUser_returnsUser() {
        MDC.put("user", "alice");

        assertEquals("alice", factory.resolveSessionUser(trino(true)));
    }

    @Test
    public void resolveSessionUser_impersonationOff_null() {
        MDC.put("user", "alice");

        assertNull(factory.resolveSessionUser(trino(false)));
    }

    @Test
    public void resolveSessionUser_noRequestUser_null() {
        assertNull(factory.resolveSessionUser(trino(true)));
    }

    @Test
    public void resolveSessionUser_nonTrinoDriver_null() {
        MDC.put("user", "alice");
        DatabaseInfo postgres = DatabaseInfo.builder()
                .databaseId("db-4")
                .jdbcUrl("jdbc:postgresql://localhost/warehouse")
                .impersonateUser(true)
                .build();

        assertNull(factory.resolveSessionUser(postgres));
    }

    @Test
    public void buildHikariConfig_sessionUser_separatePoolRunningAsUser() {
        HikariConfig config = factory.buildHikariConfig(trino(true), "alice");

        assertEquals("Pool-db-3-alice", config.getPoolName());
        assertEquals("service", config.getUsername());
        assertEquals("alice", config.getDataSourceProperties().getProperty(JdbcCursorFactory.TRINO_SESSION_USER_PROPERTY));
        assertEquals(0, config.getMinimumIdle());
    }

    @Test
    public void buildHikariConfig_noSessionUser_noOverride() {
        HikariConfig config = factory.buildHikariConfig(trino(true));

        assertEquals("Pool-db-3", config.getPoolName());
        assertNull(config.getDataSourceProperties().getProperty(JdbcCursorFactory.TRINO_SESSION_USER_PROPERTY));
    }

    @Test
    public void closeDatabase_noPools_noop() {
        assertDoesNotThrow(() -> factory.closeDatabase("never-opened"));
    }
}
