package com.querybridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.querybridge.model.DatabaseInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DatabaseResponse {
    private String databaseId;
    private String name;
    private String jdbcUrl;
    private boolean expandRows;
    private boolean impersonateUser;
    private OffsetDateTime registeredAt;
    private String traceId;

    public static DatabaseResponse from(DatabaseInfo database, String traceId) {
        return DatabaseResponse.builder()
                .databaseId(database.getDatabaseId())
                .name(database.getName())
                .jdbcUrl(database.getJdbcUrl())
                .expandRows(database.isExpandRows())
                .impersonateUser(database.isImpersonateUser())
                .registeredAt(database.getRegisteredAt())
                .traceId(traceId)
                .build();
    }
}
