package com.sanctionsentinel.sources.api;

import com.sanctionsentinel.core.model.SanctionsSource;

/**
 * Turns one authority's raw publication into canonical entities. Adapters are stateless;
 * fetching, deduplication and persistence happen outside them.
 */
public interface SourceAdapter {
    SanctionsSource source();

    SourceFetchConfig fetchConfig();

    /**
     * Parses a complete payload. Malformed records are reported in the result and skipped;
     * a payload that cannot be read as a whole fails with a {@link ParseException.Level#FORMAT}
     * exception.
     */
    ParseResult parse(byte[] raw) throws ParseException;
}
