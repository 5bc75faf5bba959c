package com.querybridge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PartitionMetadata {
    /** Partition columns, sorted by name. */
    private List<String> cols;
    /** Values of the newest partition keyed by column; values are null when the table has no partitions yet. */
    private Map<String, Object> latest;
    private String partitionQuery;
}
