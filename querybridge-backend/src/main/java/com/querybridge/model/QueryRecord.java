package com.querybridge.model;

import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle state of one submitted statement.
 *
 * <p>The {@code extra} side-channel is guarded by the record's monitor: the executing thread
 * writes the cancel id while a stop request may concurrently raise the early-cancel flag.
 */
public class QueryRecord {

    /** Remote query id that a cancel command can target. */
    public static final String CANCEL_QUERY_KEY = "cancel_query";

    /** Set when a stop was requested before the remote query id was known. */
    public static final String EARLY_CANCEL_KEY = "early_cancel_query";

    @Getter
    private final String id;

    @Getter
    private final String databaseId;

    @Getter
    private final String sql;

    @Getter
    @Setter
    private volatile QueryStatus status = QueryStatus.PENDING;

    @Getter
    @Setter
    private volatile String trackingUrl;

    @Getter
    @Setter
    private volatile String errorMessage;

    @Getter
    @Setter
    private volatile String errorKind;

    @Getter
    @Setter
    private volatile long rowCount;

    @Getter
    private final OffsetDateTime createdAt;

    @Getter
    @Setter
    private volatile OffsetDateTime endedAt;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public QueryRecord(String id, String databaseId, String sql) {
        this.id = Objects.requireNonNull(id, "id");
        this.databaseId = databaseId;
        this.sql = sql;
        this.createdAt = OffsetDateTime.now();
    }

    public synchronized void setExtraJsonKey(String key, Object value) {
        extra.put(key, value);
    }

    public synchronized void removeExtraKey(String key) {
        extra.remove(key);
    }

    public synchronized boolean hasExtraKey(String key) {
        return extra.containsKey(key);
    }

    public synchronized Object getExtraValue(String key) {
        return extra.get(key);
    }

    public synchronized boolean isExtraFlagSet(String key) {
        return Boolean.TRUE.equals(extra.get(key));
    }

    /**
     * Snapshot of the side-channel.
     *
     * @return copy of the extra mapping
     */
    public synchronized Map<String, Object> getExtra() {
        return new LinkedHashMap<>(extra);
    }

    public String getCancelQueryId() {
        Object value = getExtraValue(CANCEL_QUERY_KEY);
        return value != null ? value.toString() : null;
    }
}
