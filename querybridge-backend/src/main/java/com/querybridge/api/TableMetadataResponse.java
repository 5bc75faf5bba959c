package com.querybridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.querybridge.model.PartitionMetadata;
import com.querybridge.model.TableMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableMetadataResponse {
    private String databaseId;
    private String schema;
    private String table;
    private PartitionMetadata partitions;
    private String view;
    private String traceId;

    public static TableMetadataResponse from(String databaseId, String schema, String table,
                                             TableMetadata metadata, String traceId) {
        return TableMetadataResponse.builder()
                .databaseId(databaseId)
                .schema(schema)
                .table(table)
                .partitions(metadata.getPartitions())
                .view(metadata.getView())
                .traceId(traceId)
                .build();
    }
}
