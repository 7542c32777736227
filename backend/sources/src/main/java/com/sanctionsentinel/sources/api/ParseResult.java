package com.sanctionsentinel.sources.api;

import com.sanctionsentinel.core.model.CanonicalEntity;

import java.util.List;

public record ParseResult(List<CanonicalEntity> entities, List<RecordError> recordErrors) {
    public ParseResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        recordErrors = recordErrors == null ? List.of() : List.copyOf(recordErrors);
    }

    public int recordsSkipped() {
        return recordErrors.size();
    }

    public boolean hasRecordErrors() {
        return !recordErrors.isEmpty();
    }
}
