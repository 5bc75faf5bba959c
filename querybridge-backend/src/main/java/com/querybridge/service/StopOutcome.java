package com.querybridge.service;

public enum StopOutcome {
    /** Remote kill command accepted. */
    CANCELLED,
    /**
     * Remote id not assigned yet. Nothing has been cancelled; the kill is sent once the id
     * appears, and the query is marked stopped only if that kill is accepted.
     */
    DEFERRED,
    /** Remote kill command rejected or unreachable. */
    NOT_CANCELLED,
    ALREADY_FINISHED
}
