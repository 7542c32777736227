package com.sanctionsentinel.core.model;

import java.time.Instant;

public record ContentSnapshot(
        SanctionsSource source,
        String contentHash,
        long sizeBytes,
        Instant capturedAt,
        String runId,
        String archivePath
) {
}
