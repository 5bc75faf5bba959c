package com.querybridge.service;

/**
 * Thrown when a database id is not registered.
 */
public class DatabaseNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DatabaseNotFoundException(String message) {
        super(message);
    }
}
