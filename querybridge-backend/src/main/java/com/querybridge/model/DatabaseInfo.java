package com.querybridge.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class DatabaseInfo {
    private String databaseId;
    private String name;
    private String jdbcUrl;
    private String username;
    private String password;
    private boolean expandRows;
    /** Run statements as the requesting user instead of the configured one. */
    private boolean impersonateUser;
    private OffsetDateTime registeredAt;
}
