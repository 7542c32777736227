package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;

/**
 * Entry points shared by the scheduler and the HTTP API.
 */
public interface RunTrigger {
    /**
     * Begins a run and executes it in the background.
     *
     * @return the id of the started run
     * @throws com.sanctionsentinel.service.ledger.ConflictException if the source is already running
     */
    String runSource(SanctionsSource source, boolean forceRefresh);

    /** Runs the whole pipeline on the calling thread and returns the terminal run. */
    ScraperRun runSourceAndWait(SanctionsSource source, boolean forceRefresh);

    void sweepStaleRuns();
}
