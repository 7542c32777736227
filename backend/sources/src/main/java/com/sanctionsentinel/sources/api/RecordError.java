package com.sanctionsentinel.sources.api;

/**
 * A record the adapter could not map; the rest of the payload is still processed.
 */
public record RecordError(String recordRef, String field, String reason) {
    public static RecordError of(ParseException exception, String recordRef) {
        return new RecordError(recordRef, exception.field(), exception.reason());
    }
}
