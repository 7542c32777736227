package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSanctionsRepositoryTest {
    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    @Test
    void committedStateSurvivesReload() throws Exception {
        Path file = Files.createTempDirectory("sanctions-repo-").resolve("state/sanctions.json");
        JsonFileSanctionsRepository repository = new JsonFileSanctionsRepository(file);
        ScraperRun run = ScraperRun.started(SanctionsSource.UK_HMT, T0);
        repository.upsertRun(run);
        repository.commitRun(InMemorySanctionsRepositoryTest.commit(run, "e1"));
        repository.markNotified(List.of("e1"), T0.plusSeconds(60), Set.of("chat"));

        JsonFileSanctionsRepository reloaded = new JsonFileSanctionsRepository(file);

        assertEquals(RunStatus.SUCCESS, reloaded.findRun(run.runId()).orElseThrow().status());
        assertEquals("Jane Roe", reloaded.getLatestEntities(SanctionsSource.UK_HMT).get(0).name());
        assertEquals(List.of("SDGT"), reloaded.getLatestEntities(SanctionsSource.UK_HMT).get(0).programs());
        assertEquals(Set.of("chat"), reloaded.findChangeEvents(run.runId()).get(0).notificationChannels());
        assertEquals("hash-" + run.runId(),
                reloaded.getLatestSnapshot(SanctionsSource.UK_HMT).orElseThrow().contentHash());
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws Exception {
        Path dir = Files.createTempDirectory("sanctions-repo-temp-");
        Path file = dir.resolve("sanctions.json");
        JsonFileSanctionsRepository repository = new JsonFileSanctionsRepository(file);
        repository.upsertRun(ScraperRun.started(SanctionsSource.OFAC, T0));
        repository.upsertRun(ScraperRun.started(SanctionsSource.UN, T0));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void unwritableLocationFailsWithoutPublishingState() throws Exception {
        Path dir = Files.createTempDirectory("sanctions-repo-blocked-");
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");
        JsonFileSanctionsRepository repository = new JsonFileSanctionsRepository(blocker.resolve("sanctions.json"));
        ScraperRun run = ScraperRun.started(SanctionsSource.OFAC, T0);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> repository.upsertRun(run));

        assertTrue(ex.getMessage().contains("Failed writing repository state"));
        assertTrue(repository.findRun(run.runId()).isEmpty());
    }

    @Test
    void corruptStateFileFailsFast() throws Exception {
        Path file = Files.createTempDirectory("sanctions-repo-corrupt-").resolve("sanctions.json");
        Files.writeString(file, "{not json");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new JsonFileSanctionsRepository(file));
        assertTrue(ex.getMessage().contains("Failed loading repository state"));
    }
}
