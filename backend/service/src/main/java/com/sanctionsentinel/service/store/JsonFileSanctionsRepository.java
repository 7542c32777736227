package com.sanctionsentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * {@link InMemorySanctionsRepository} backed by a single JSON state file. Each write goes to a
 * temporary sibling first and is moved over the previous file.
 */
public class JsonFileSanctionsRepository extends InMemorySanctionsRepository {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Logger LOGGER = Logger.getLogger(JsonFileSanctionsRepository.class.getName());

    private final Path file;

    public JsonFileSanctionsRepository(Path file) {
        super(load(file));
        this.file = file;
    }

    @Override
    protected void persist(RepositoryState next) {
        StateFile contents = new StateFile(
                next.entities(),
                next.latestSnapshots(),
                next.snapshots(),
                new ArrayList<>(next.changeEvents().values()),
                new ArrayList<>(next.runs().values())
        );
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    MAPPER.writeValue(out, contents);
                }
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing repository state to " + file, e);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warning("Atomic move unsupported for " + file + "; falling back to replace");
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static RepositoryState load(Path file) {
        RepositoryState state = RepositoryState.empty();
        if (!Files.exists(file)) {
            return state;
        }
        try (InputStream in = Files.newInputStream(file)) {
            StateFile loaded = MAPPER.readValue(in, StateFile.class);
            if (loaded.entities() != null) {
                state.entities().putAll(loaded.entities());
            }
            if (loaded.latestSnapshots() != null) {
                state.latestSnapshots().putAll(loaded.latestSnapshots());
            }
            if (loaded.snapshots() != null) {
                state.snapshots().addAll(loaded.snapshots());
            }
            if (loaded.changeEvents() != null) {
                loaded.changeEvents().forEach(event -> state.changeEvents().put(event.eventId(), event));
            }
            if (loaded.runs() != null) {
                loaded.runs().forEach(run -> state.runs().put(run.runId(), run));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading repository state from " + file, e);
        }
        LOGGER.info(() -> String.format("Loaded repository state from %s: %d runs, %d change events",
                file, state.runs().size(), state.changeEvents().size()));
        return state;
    }

    private record StateFile(
            Map<SanctionsSource, List<CanonicalEntity>> entities,
            Map<SanctionsSource, ContentSnapshot> latestSnapshots,
            List<ContentSnapshot> snapshots,
            List<ChangeEvent> changeEvents,
            List<ScraperRun> runs
    ) {
    }
}
