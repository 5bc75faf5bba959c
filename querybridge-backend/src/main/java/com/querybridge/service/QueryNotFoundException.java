package com.querybridge.service;

/**
 * Thrown when a query id is unknown to the query store.
 */
public class QueryNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public QueryNotFoundException(String message) {
        super(message);
    }
}
