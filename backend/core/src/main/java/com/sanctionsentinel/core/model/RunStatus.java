package com.sanctionsentinel.core.model;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED,
    PARTIAL;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean isSuccessful() {
        return this == SUCCESS || this == PARTIAL || this == SKIPPED;
    }
}
