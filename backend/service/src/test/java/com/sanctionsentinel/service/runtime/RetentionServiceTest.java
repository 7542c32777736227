package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.service.store.InMemorySanctionsRepository;
import com.sanctionsentinel.service.store.JsonlEventStore;
import com.sanctionsentinel.service.store.PayloadArchive;
import com.sanctionsentinel.service.store.RunCommit;
import com.sanctionsentinel.service.support.MutableClock;
import com.sanctionsentinel.service.support.TestEntities;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetentionServiceTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemorySanctionsRepository repository = new InMemorySanctionsRepository();

    @Test
    void sweepPrunesEverythingOlderThanWindowExceptLatestState() throws Exception {
        Path dir = Files.createTempDirectory("retention-");
        PayloadArchive archive = new PayloadArchive(dir.resolve("archive"));
        JsonlEventStore eventStore = new JsonlEventStore(dir.resolve("events.jsonl"));

        Path oldPayload = commit(archive, SanctionsSource.OFAC, T0);
        Path newPayload = commit(archive, SanctionsSource.OFAC, T0.plus(Duration.ofDays(99)));
        Path onlyUnPayload = commit(archive, SanctionsSource.UN, T0);
        Files.setLastModifiedTime(oldPayload, FileTime.from(T0));
        Files.setLastModifiedTime(newPayload, FileTime.from(T0.plus(Duration.ofDays(99))));
        Files.setLastModifiedTime(onlyUnPayload, FileTime.from(T0));
        eventStore.append(new AlertRaised(T0, "run_failed", "old", Map.of()));
        eventStore.append(new AlertRaised(T0.plus(Duration.ofDays(99)), "run_failed", "recent", Map.of()));

        clock.set(T0.plus(Duration.ofDays(100)));
        RetentionService retention = new RetentionService(repository, archive, eventStore, clock, Duration.ofDays(30));
        RetentionService.Report report = retention.sweep();

        assertEquals(T0.plus(Duration.ofDays(70)), report.cutoff());
        assertEquals(2, report.runsRemoved());
        assertEquals(1, report.snapshotsRemoved());
        assertEquals(1, report.archivedPayloadsRemoved());
        assertEquals(1, report.eventsRemoved());
        assertFalse(Files.exists(oldPayload));
        assertTrue(Files.exists(onlyUnPayload));
        assertTrue(Files.exists(newPayload));
        assertEquals(1, repository.getLatestEntities(SanctionsSource.UN).size());
        assertEquals(1, eventStore.query(Instant.EPOCH, Optional.empty(), 10).size());
    }

    @Test
    void repeatedSweepFindsNothingNew() {
        commit(PayloadArchive.disabled(), SanctionsSource.OFAC, T0);
        clock.set(T0.plus(Duration.ofDays(200)));
        RetentionService retention = new RetentionService(repository, PayloadArchive.disabled(), null, clock,
                Duration.ofDays(90));

        retention.sweep();
        RetentionService.Report second = retention.sweep();

        assertEquals(0, second.runsRemoved());
        assertEquals(0, second.snapshotsRemoved());
        assertEquals(0, second.eventsRemoved());
        assertTrue(repository.getLatestSnapshot(SanctionsSource.OFAC).isPresent());
    }

    @Test
    void retentionWindowMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionService(repository,
                PayloadArchive.disabled(), null, clock, Duration.ZERO));
    }

    private Path commit(PayloadArchive archive, SanctionsSource source, Instant startedAt) {
        ScraperRun run = ScraperRun.started(source, startedAt);
        Path payload = archive.store(source, run.runId(), new byte[]{1, 2, 3}).orElse(null);
        ScraperRun done = run.complete(startedAt.plusSeconds(30), RunStatus.SUCCESS, null, null, 0);
        ContentSnapshot snapshot = new ContentSnapshot(source, "hash-" + run.runId(), 3, startedAt, run.runId(),
                payload == null ? null : payload.toString());
        repository.commitRun(new RunCommit(done,
                List.of(TestEntities.person(source, "uid-" + run.runId(), "Jane Roe", "SDGT")), List.of(), snapshot));
        return payload;
    }
}
