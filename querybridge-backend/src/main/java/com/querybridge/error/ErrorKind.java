package com.querybridge.error;

/**
 * Normalized failure kinds for remote statement execution.
 */
public enum ErrorKind {
    CONNECTION_ERROR(true),
    DATABASE_ERROR(false),
    OPERATIONAL_ERROR(true),
    PROGRAMMING_ERROR(false),
    UNKNOWN_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a caller may retry the statement under its own retry policy.
     *
     * @return true for transport and resource failures
     */
    public boolean isRetryable() {
        return retryable;
    }
}
