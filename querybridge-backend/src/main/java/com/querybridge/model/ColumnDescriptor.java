package com.querybridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.querybridge.model.type.ColumnType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One column of a described result shape. Nested row fields are addressed by a dotted
 * {@code name}; {@code path} keeps the individual segments so names containing dots
 * still quote correctly.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColumnDescriptor {
    private String name;
    private String columnName;
    @JsonIgnore
    private ColumnType type;
    private String declaredType;
    private boolean temporal;
    private String queryAs;
    @JsonIgnore
    private List<String> path;

    /**
     * Path segments from the root column; a base column is its own single segment.
     *
     * @return path segments
     */
    public List<String> pathSegments() {
        if (path != null && !path.isEmpty()) {
            return path;
        }
        return List.of(name);
    }
}
