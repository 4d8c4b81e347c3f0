package io.tracebridge.core.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileCheckpointStore implements CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileCheckpointStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Map<String, SessionCheckpoint> load() {
        if (!Files.exists(path)) {
            return Map.of();
        }
        try {
            Map<String, SessionCheckpoint> loaded = mapper.readValue(
                Files.readString(path),
                new TypeReference<LinkedHashMap<String, SessionCheckpoint>>() {
                }
            );
            return loaded == null ? Map.of() : loaded;
        } catch (Exception e) {
            LOG.warn("Ignoring unreadable checkpoint file {}: {}", path, e.getMessage());
            return Map.of();
        }
    }

    @Override
    public synchronized void save(Map<String, SessionCheckpoint> checkpoints) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoints);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
