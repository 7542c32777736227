package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Copy-on-write repository: every write builds the next {@link RepositoryState}, hands it to
 * {@link #persist(RepositoryState)} and only then publishes it. Readers hold the read lock, so a
 * half-applied commit is never observable.
 */
public class InMemorySanctionsRepository implements SanctionsRepository {
    private static final Logger LOGGER = Logger.getLogger(InMemorySanctionsRepository.class.getName());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private RepositoryState state;

    public InMemorySanctionsRepository() {
        this(RepositoryState.empty());
    }

    protected InMemorySanctionsRepository(RepositoryState initial) {
        this.state = initial.copy();
    }

    /** Hook for durable subclasses; a failure here leaves the published state untouched. */
    protected void persist(RepositoryState next) {
    }

    @Override
    public List<CanonicalEntity> getLatestEntities(SanctionsSource source) {
        return read(current -> current.entities().getOrDefault(source, List.of()));
    }

    @Override
    public void replaceEntities(SanctionsSource source, List<CanonicalEntity> entities, String runId) {
        write(next -> next.entities().put(source, List.copyOf(entities)));
        LOGGER.fine(() -> "Replaced " + entities.size() + " " + source + " entities for run " + runId);
    }

    @Override
    public Optional<ContentSnapshot> getLatestSnapshot(SanctionsSource source) {
        return read(current -> Optional.ofNullable(current.latestSnapshots().get(source)));
    }

    @Override
    public void appendChangeEvents(List<ChangeEvent> events) {
        write(next -> addEvents(next, events));
    }

    @Override
    public void upsertRun(ScraperRun run) {
        write(next -> next.runs().put(run.runId(), run));
    }

    @Override
    public void commitRun(RunCommit commit) {
        write(next -> {
            addEvents(next, commit.events());
            next.entities().put(commit.run().source(), commit.entities());
            next.latestSnapshots().put(commit.snapshot().source(), commit.snapshot());
            next.snapshots().add(commit.snapshot());
            next.runs().put(commit.run().runId(), commit.run());
        });
    }

    @Override
    public Optional<ScraperRun> findRun(String runId) {
        return read(current -> Optional.ofNullable(current.runs().get(runId)));
    }

    @Override
    public List<ScraperRun> findRuns(SanctionsSource source, Instant since) {
        return read(current -> current.runs().values().stream()
                .filter(run -> source == null || run.source() == source)
                .filter(run -> since == null || !run.startedAt().isBefore(since))
                .sorted(Comparator.comparing(ScraperRun::startedAt).reversed())
                .toList());
    }

    @Override
    public List<ChangeEvent> findChangeEvents(String runId) {
        return read(current -> current.changeEvents().values().stream()
                .filter(event -> runId.equals(event.runId()))
                .toList());
    }

    @Override
    public int markNotified(Collection<String> eventIds, Instant sentAt, Set<String> channels) {
        int[] stamped = {0};
        write(next -> {
            for (String eventId : new HashSet<>(eventIds)) {
                ChangeEvent event = next.changeEvents().get(eventId);
                if (event == null) {
                    throw new IllegalArgumentException("Unknown change event " + eventId);
                }
                if (!event.notified()) {
                    next.changeEvents().put(eventId, event.withNotification(sentAt, channels));
                    stamped[0]++;
                }
            }
        });
        return stamped[0];
    }

    @Override
    public PruneResult pruneBefore(Instant cutoff) {
        int[] removed = {0, 0};
        write(next -> {
            removed[0] = removeIf(next.runs().values(),
                    run -> run.status().isTerminal() && run.startedAt().isBefore(cutoff));
            removed[1] = removeIf(next.snapshots(), snapshot -> snapshot.capturedAt().isBefore(cutoff)
                    && !snapshot.equals(next.latestSnapshots().get(snapshot.source())));
        });
        PruneResult result = new PruneResult(removed[0], removed[1]);
        LOGGER.info(() -> "Pruned records older than " + cutoff + ": " + result);
        return result;
    }

    /** Point-in-time copy for callers that need several tables at once. */
    public RepositoryState snapshotState() {
        return read(RepositoryState::copy);
    }

    private static <T> int removeIf(Collection<T> values, Predicate<T> condition) {
        int before = values.size();
        values.removeIf(condition);
        return before - values.size();
    }

    private static void addEvents(RepositoryState next, List<ChangeEvent> events) {
        for (ChangeEvent event : events) {
            if (next.changeEvents().putIfAbsent(event.eventId(), event) != null) {
                throw new IllegalArgumentException("Duplicate change event id " + event.eventId());
            }
        }
    }

    private <T> T read(Function<RepositoryState, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Consumer<RepositoryState> mutation) {
        lock.writeLock().lock();
        try {
            RepositoryState next = state.copy();
            mutation.accept(next);
            persist(next);
            state = next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mutable working copy of every table. Lists stored in it are immutable; maps are copied by
     * {@link #copy()}.
     */
    public record RepositoryState(
            Map<SanctionsSource, List<CanonicalEntity>> entities,
            Map<SanctionsSource, ContentSnapshot> latestSnapshots,
            List<ContentSnapshot> snapshots,
            Map<String, ChangeEvent> changeEvents,
            Map<String, ScraperRun> runs
    ) {
        public static RepositoryState empty() {
            return new RepositoryState(new EnumMap<>(SanctionsSource.class), new EnumMap<>(SanctionsSource.class),
                    new ArrayList<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
        }

        public RepositoryState copy() {
            Map<SanctionsSource, List<CanonicalEntity>> entityCopy = new EnumMap<>(SanctionsSource.class);
            entityCopy.putAll(entities);
            Map<SanctionsSource, ContentSnapshot> snapshotCopy = new EnumMap<>(SanctionsSource.class);
            snapshotCopy.putAll(latestSnapshots);
            return new RepositoryState(entityCopy, snapshotCopy, new ArrayList<>(snapshots),
                    new LinkedHashMap<>(changeEvents), new LinkedHashMap<>(runs));
        }
    }
}
