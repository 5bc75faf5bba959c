package com.querybridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.querybridge.model.QueryRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryResponse {
    private String queryId;
    private String databaseId;
    private String status;
    private String cancelQueryId;
    private String trackingUrl;
    private long rowCount;
    private String errorKind;
    private String errorMessage;
    private Map<String, Object> extra;
    private OffsetDateTime createdAt;
    private OffsetDateTime endedAt;
    private String traceId;

    public static QueryResponse from(QueryRecord query, String traceId) {
        return QueryResponse.builder()
                .queryId(query.getId())
                .databaseId(query.getDatabaseId())
                .status(query.getStatus().name())
                .cancelQueryId(query.getCancelQueryId())
                .trackingUrl(query.getTrackingUrl())
                .rowCount(query.getRowCount())
                .errorKind(query.getErrorKind())
                .errorMessage(query.getErrorMessage())
                .extra(query.getExtra())
                .createdAt(query.getCreatedAt())
                .endedAt(query.getEndedAt())
                .traceId(traceId)
                .build();
    }
}
