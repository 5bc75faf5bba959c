package com.querybridge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An index-like grouping of columns. For Trino the only kind reported is the table's
 * partition key, named {@value #PARTITION}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IndexDescriptor {
    public static final String PARTITION = "partition";

    private String name;
    private List<String> columnNames;
    private boolean unique;
}
