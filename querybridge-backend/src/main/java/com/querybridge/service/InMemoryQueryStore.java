package com.querybridge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybridge.model.QueryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps query records in memory. Records are held by identity, so a stop request and the
 * executing thread see the same instance; the serialized side-channel is kept alongside to
 * reject values that could not be persisted as JSON.
 */
@Slf4j
@Component
public class InMemoryQueryStore implements QueryStore {
    private final Map<String, QueryRecord> queries = new ConcurrentHashMap<>();
    private final Map<String, String> extraJson = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;

    public InMemoryQueryStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public QueryRecord load(String queryId) {
        QueryRecord query = queryId != null ? queries.get(queryId) : null;
        if (query == null) {
            throw new QueryNotFoundException("Query not found: " + queryId);
        }
        return query;
    }

    @Override
    public void save(QueryRecord query) {
        String json = serializeExtra(query);
        queries.put(query.getId(), query);
        extraJson.put(query.getId(), json);
        log.debug("Query {}: saved status={} extra={}", query.getId(), query.getStatus(), json);
    }

    /**
     * Last persisted side-channel of a query.
     *
     * @param queryId query id
     * @return JSON text, or null if the query was never saved
     */
    public String getExtraJson(String queryId) {
        return extraJson.get(queryId);
    }

    @Override
    public boolean create(QueryRecord query) {
        String json = serializeExtra(query);
        if (queries.putIfAbsent(query.getId(), query) != null) {
            return false;
        }
        extraJson.put(query.getId(), json);
        log.debug("Query {}: created status={}", query.getId(), query.getStatus());
        return true;
    }

    private String serializeExtra(QueryRecord query) {
        try {
            return objectMapper.writeValueAsString(query.getExtra());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Query " + query.getId() + ": extra is not JSON-serializable", e);
        }
    }
}
