package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.SanctionsSource;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadArchiveTest {
    @Test
    void storesPayloadUnderSourceAndRunId() throws Exception {
        Path base = Files.createTempDirectory("payload-archive-");
        PayloadArchive archive = new PayloadArchive(base);
        byte[] raw = "<sdnList/>".getBytes(StandardCharsets.UTF_8);

        Path pointer = archive.store(SanctionsSource.UK_HMT, "uk_hmt_1700000000000", raw).orElseThrow();

        assertEquals(base.resolve("uk_hmt").resolve("uk_hmt_1700000000000.raw"), pointer);
        assertArrayEquals(raw, archive.read(pointer));
    }

    @Test
    void disabledArchiveStoresNothing() {
        PayloadArchive archive = PayloadArchive.disabled();
        assertFalse(archive.enabled());
        assertTrue(archive.store(SanctionsSource.OFAC, "ofac_1", new byte[]{1}).isEmpty());
        assertEquals(0, archive.pruneBefore(Instant.now(), List.of()));
    }

    @Test
    void pruneDeletesOldPayloadsExceptKeptOnes() throws Exception {
        Path base = Files.createTempDirectory("payload-archive-prune-");
        PayloadArchive archive = new PayloadArchive(base);
        Instant cutoff = Instant.parse("2026-01-01T00:00:00Z");
        Path old = archive.store(SanctionsSource.OFAC, "ofac_1", new byte[]{1}).orElseThrow();
        Path latest = archive.store(SanctionsSource.UN, "un_1", new byte[]{2}).orElseThrow();
        Path fresh = archive.store(SanctionsSource.OFAC, "ofac_2", new byte[]{3}).orElseThrow();
        Files.setLastModifiedTime(old, FileTime.from(cutoff.minusSeconds(86_400)));
        Files.setLastModifiedTime(latest, FileTime.from(cutoff.minusSeconds(86_400)));
        Files.setLastModifiedTime(fresh, FileTime.from(cutoff.plusSeconds(60)));

        int deleted = archive.pruneBefore(cutoff, List.of(latest));

        assertEquals(1, deleted);
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(latest));
        assertTrue(Files.exists(fresh));
    }
}
