package com.agentmesh.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes a {@link Snapshot} as a JSON file. Writes go to a temporary sibling file that
 * is then moved over the target, so readers never see a partial snapshot.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public SnapshotStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SnapshotStore(Path path) {
        this(path, new ObjectMapper());
    }

    public Path path() {
        return path;
    }

    public void save(Snapshot snapshot) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Snapshot written to {} ({} endpoints)", path, snapshot.entries().size());
        } catch (IOException e) {
            throw new SnapshotException("Failed to write snapshot " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the stored snapshot, or null when none exists
     * @throws SnapshotException when the file exists but cannot be read as a snapshot
     */
    public Snapshot load() {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            Snapshot snapshot = mapper.readValue(path.toFile(), Snapshot.class);
            if (snapshot == null) {
                throw new SnapshotException("Snapshot " + path + " is empty", null);
            }
            return snapshot;
        } catch (IOException e) {
            throw new SnapshotException("Corrupt snapshot " + path + ": " + e.getMessage(), e);
        }
    }
}
