package com.querybridge.service;

import com.querybridge.model.QueryRecord;

/**
 * Persistence for query records. Saves must be idempotent for unchanged fields.
 */
public interface QueryStore {

    /**
     * Load a query record.
     *
     * @param queryId query id
     * @return the record
     * @throws QueryNotFoundException if the id is unknown
     */
    QueryRecord load(String queryId);

    void save(QueryRecord query);

    /**
     * Store a new query record, unless one with the same id is already stored.
     *
     * @param query new record
     * @return false if the id was taken; the stored record is left untouched
     */
    boolean create(QueryRecord query);
}
