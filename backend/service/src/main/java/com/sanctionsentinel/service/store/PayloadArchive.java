package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Raw payload archive laid out as {@code <baseDir>/<source>/<runId>.raw}. A disabled archive
 * stores nothing and returns no pointer.
 */
public class PayloadArchive {
    private static final Logger LOGGER = Logger.getLogger(PayloadArchive.class.getName());

    private final Path baseDir;

    public PayloadArchive(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static PayloadArchive disabled() {
        return new PayloadArchive(null);
    }

    public boolean enabled() {
        return baseDir != null;
    }

    public Optional<Path> store(SanctionsSource source, String runId, byte[] raw) {
        if (baseDir == null) {
            return Optional.empty();
        }
        Path dir = baseDir.resolve(source.name().toLowerCase(Locale.ROOT));
        Path target = dir.resolve(runId + ".raw");
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, runId, ".part");
            Files.write(temp, raw);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            return Optional.of(target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed archiving payload for run " + runId + " to " + target, e);
        }
    }

    public byte[] read(Path pointer) {
        try {
            return Files.readAllBytes(pointer);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading archived payload " + pointer, e);
        }
    }

    /**
     * Deletes archived payloads last modified before {@code cutoff}, except those in {@code keep}.
     *
     * @return number of files deleted
     */
    public int pruneBefore(Instant cutoff, Collection<Path> keep) {
        if (baseDir == null || !Files.isDirectory(baseDir)) {
            return 0;
        }
        Set<Path> protectedFiles = keep.stream()
                .map(path -> path.toAbsolutePath().normalize())
                .collect(Collectors.toSet());
        List<Path> candidates;
        try (Stream<Path> files = Files.walk(baseDir, 2)) {
            candidates = files.filter(path -> path.getFileName().toString().endsWith(".raw")).toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed listing archived payloads in " + baseDir, e);
        }
        int deleted = 0;
        for (Path file : candidates) {
            if (protectedFiles.contains(file.toAbsolutePath().normalize())) {
                continue;
            }
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed pruning archived payload " + file, e);
            }
        }
        int removed = deleted;
        LOGGER.info(() -> "Pruned " + removed + " archived payloads older than " + cutoff);
        return deleted;
    }
}
