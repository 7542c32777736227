package com.sanctionsentinel.core.model;

public enum RunStage {
    IDLE,
    DOWNLOADING,
    DEDUPLICATING,
    PARSING,
    DIFFING,
    CLASSIFYING,
    PERSISTING,
    NOTIFYING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
