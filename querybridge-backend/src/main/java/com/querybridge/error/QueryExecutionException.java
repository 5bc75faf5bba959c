package com.querybridge.error;

/**
 * Thrown when a remote statement fails; carries the normalized {@link ErrorKind}
 * and keeps the driver exception as its cause.
 */
public class QueryExecutionException extends RuntimeException {
    private final ErrorKind kind;

    /**
     * Create a new exception.
     *
     * @param kind normalized error kind
     * @param message original driver message
     * @param cause original driver exception
     */
    public QueryExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
