package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /** Newest {@code limit} events at or after {@code since}, oldest first. */
    List<Event> query(Instant since, Optional<String> type, int limit);

    /**
     * Drops events older than {@code cutoff}.
     *
     * @return number of events removed
     */
    int pruneBefore(Instant cutoff);
}
