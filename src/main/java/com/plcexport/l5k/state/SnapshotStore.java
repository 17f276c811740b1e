package com.plcexport.l5k.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link ProjectSnapshot} files as JSON.
 */
public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final ObjectMapper objectMapper;

    public SnapshotStore() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public SnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectSnapshot read(Path path) throws IOException {
        ProjectSnapshot snapshot = objectMapper.readValue(path.toFile(), ProjectSnapshot.class);
        if (snapshot.getVersion() > ProjectSnapshot.CURRENT_VERSION) {
            log.warn("State file {} has version {}, newer than {}", path, snapshot.getVersion(),
                    ProjectSnapshot.CURRENT_VERSION);
        }
        log.info("Read {} saved entries from {}", snapshot.getEntries().size(), path);
        return snapshot;
    }

    public void write(Path path, ProjectSnapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), snapshot);
        log.info("Wrote {} entries to {}", snapshot.getEntries().size(), path);
    }
}
