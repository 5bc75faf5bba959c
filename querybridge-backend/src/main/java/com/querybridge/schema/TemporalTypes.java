package com.querybridge.schema;

import com.querybridge.model.type.ColumnType;
import com.querybridge.model.type.PrimitiveType;

import java.util.Set;

public final class TemporalTypes {

    private static final Set<String> TEMPORAL_BASE_NAMES = Set.of(
            "date",
            "time",
            "timestamp",
            "time with time zone",
            "time without time zone",
            "timestamp with time zone",
            "timestamp without time zone"
    );

    private TemporalTypes() {
    }

    public static boolean isTemporal(ColumnType type) {
        return type instanceof PrimitiveType primitive && TEMPORAL_BASE_NAMES.contains(primitive.getBaseName());
    }
}
