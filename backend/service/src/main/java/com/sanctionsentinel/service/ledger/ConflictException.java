package com.sanctionsentinel.service.ledger;

import com.sanctionsentinel.core.model.SanctionsSource;

/**
 * A run was requested for a source that already has one in progress.
 */
public class ConflictException extends RuntimeException {
    private final SanctionsSource source;
    private final String runningRunId;

    public ConflictException(SanctionsSource source, String runningRunId) {
        super("Source " + source + " is already running" + (runningRunId == null ? "" : " (run " + runningRunId + ")"));
        this.source = source;
        this.runningRunId = runningRunId;
    }

    public SanctionsSource source() {
        return source;
    }

    public String runningRunId() {
        return runningRunId;
    }
}
