package com.querybridge.model;

public enum QueryStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == STOPPED;
    }
}
