package com.querybridge.service;

import com.querybridge.api.DatabaseRegisterRequest;
import com.querybridge.model.DatabaseInfo;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DatabaseRegistry {
    private final Map<String, DatabaseInfo> databases = new ConcurrentHashMap<>();

    public DatabaseInfo register(DatabaseRegisterRequest request) {
        String databaseId = UUID.randomUUID().toString();
        DatabaseInfo databaseInfo = DatabaseInfo.builder()
                .databaseId(databaseId)
                .name(request.getName())
                .jdbcUrl(request.getJdbcUrl())
                .username(request.getUsername())
                .password(request.getPassword())
                .expandRows(request.isExpandRows())
                .impersonateUser(request.isImpersonateUser())
                .registeredAt(OffsetDateTime.now())
                .build();

        databases.put(databaseId, databaseInfo);
        return databaseInfo;
    }

    public Optional<DatabaseInfo> getDatabase(String databaseId) {
        if (databaseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(databases.get(databaseId));
    }

    public DatabaseInfo requireDatabase(String databaseId) {
        return getDatabase(databaseId)
                .orElseThrow(() -> new DatabaseNotFoundException("Database not found: " + databaseId));
    }

    public List<DatabaseInfo> listDatabases() {
        return databases.values().stream()
                .sorted((a, b) -> a.getRegisteredAt().compareTo(b.getRegisteredAt()))
                .toList();
    }

    public boolean removeDatabase(String databaseId) {
        return databases.remove(databaseId) != null;
    }
}
