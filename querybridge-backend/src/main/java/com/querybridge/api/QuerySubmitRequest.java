package com.querybridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuerySubmitRequest {
    @NotBlank(message = "Database ID is required")
    private String databaseId;

    @NotBlank(message = "SQL is required")
    private String sql;

    /** Optional caller-chosen id, so the query can be stopped while the submit call blocks. */
    private String queryId;
}
