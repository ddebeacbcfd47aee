package com.buildsentinel.core.state;

import com.buildsentinel.core.json.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the engine snapshot as a JSON file.
 *
 * <h3>Atomicity</h3>
 * <p>
 * Every save writes a temporary file next to the target and moves it over the
 * target with {@link StandardCopyOption#ATOMIC_MOVE}. File systems without
 * atomic rename fall back to a plain replacing move. Readers therefore see
 * either the previous snapshot or the new one, never a torn write.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path file;
    private final ObjectMapper mapper = JsonMappers.lenient();

    /**
     * @param file snapshot location; parent directories are created on first
     *             save
     */
    public JsonFileStateStore(Path file) {
        this.file = Objects.requireNonNull(file, "State file path must not be null").toAbsolutePath();
    }

    @Override
    public Optional<StateSnapshot> load() {
        if (!Files.exists(file)) {
            LOG.info("No alert state at {}, starting fresh", file);
            return Optional.empty();
        }
        try {
            StateSnapshot snapshot = mapper.readValue(file.toFile(), StateSnapshot.class);
            if (snapshot.getVersion() > StateSnapshot.CURRENT_VERSION) {
                LOG.warn("Alert state {} has version {} (expected <= {}); reading known fields only",
                        file, snapshot.getVersion(), StateSnapshot.CURRENT_VERSION);
            }
            LOG.info("Loaded alert state from {}: {}", file, snapshot);
            return Optional.of(snapshot);
        } catch (IOException | RuntimeException e) {
            throw new StateStoreException("Failed to read alert state from " + file, e);
        }
    }

    @Override
    public void save(StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Path tmp = null;
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            move(tmp, file);
            LOG.debug("Saved alert state to {}", file);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            throw new StateStoreException("Failed to write alert state to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary state file {}: {}", tmp, e.getMessage());
        }
    }
}
