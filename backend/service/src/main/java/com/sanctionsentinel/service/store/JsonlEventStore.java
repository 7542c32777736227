package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Append-only JSON Lines log of pipeline events. A torn final line left by an interrupted
 * append is ignored on read; corruption anywhere else is an error. Queries stream the file and
 * keep only the newest {@code limit} matches in memory.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending " + event.type() + " to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        Deque<Event> newest = new ArrayDeque<>();
        lock.lock();
        try {
            scan(entry -> {
                Event event = entry.event();
                if (event.timestamp().isBefore(since) || type.filter(t -> !t.equals(event.type())).isPresent()) {
                    return;
                }
                newest.addLast(event);
                if (newest.size() > limit) {
                    newest.removeFirst();
                }
            });
        } finally {
            lock.unlock();
        }
        return new ArrayList<>(newest);
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return 0;
            }
            List<String> kept = new ArrayList<>();
            int[] dropped = {0};
            scan(entry -> {
                if (entry.event().timestamp().isBefore(cutoff)) {
                    dropped[0]++;
                } else {
                    kept.add(entry.line());
                }
            });
            if (dropped[0] == 0) {
                return 0;
            }
            Path temp = Files.createTempFile(file.toAbsolutePath().getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, kept, StandardCharsets.UTF_8);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            LOGGER.info("Pruned " + dropped[0] + " events older than " + cutoff + " from " + file);
            return dropped[0];
        } catch (IOException e) {
            throw new IllegalStateException("Failed pruning events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void scan(Consumer<Entry> visitor) {
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            int undecodedLine = 0;
            RuntimeException undecoded = null;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (undecoded != null) {
                    throw new IllegalStateException("Invalid JSONL event at line " + undecodedLine, undecoded);
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (IllegalStateException | IllegalArgumentException decodeError) {
                    undecoded = decodeError;
                    undecodedLine = lineNumber;
                    continue;
                }
                visitor.accept(new Entry(line, event));
            }
            if (undecoded != null) {
                LOGGER.warning("Ignoring torn final line " + undecodedLine + " in " + file);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file, e);
        }
    }

    private record Entry(String line, Event event) {
    }
}
