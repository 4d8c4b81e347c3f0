package io.tracebridge.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnEmptyMappingWhenFileIsMissingOrCorrupt() throws Exception {
        Path path = tempDir.resolve("state/tracebridge_state.json");
        FileCheckpointStore store = new FileCheckpointStore(path);

        assertThat(store.load()).isEmpty();

        Files.createDirectories(path.getParent());
        Files.writeString(path, "{not json");
        assertThat(store.load()).isEmpty();
    }

    @Test
    void shouldPersistCheckpointsAcrossInstances() throws Exception {
        Path path = tempDir.resolve("state/tracebridge_state.json");
        Instant updated = Instant.parse("2026-03-01T10:15:30Z");

        new FileCheckpointStore(path).save(Map.of("s1", new SessionCheckpoint(12, 3, updated, true)));
        Map<String, SessionCheckpoint> loaded = new FileCheckpointStore(path).load();

        assertThat(loaded).containsEntry("s1", new SessionCheckpoint(12, 3, updated, true));
        assertThat(Files.readString(path)).contains("\"updatedAt\" : \"2026-03-01T10:15:30Z\"");
        assertThat(Files.exists(path.resolveSibling("tracebridge_state.json.tmp"))).isFalse();
    }

    @Test
    void shouldReadLegacySnakeCaseFields() throws Exception {
        Path path = tempDir.resolve("langfuse_state.json");
        Files.writeString(path, """
            {
              "abc": {"last_line": 40, "turn_count": 6, "updated": "2026-01-05T08:00:00Z"}
            }
            """);

        SessionCheckpoint checkpoint = new FileCheckpointStore(path).load().get("abc");

        assertThat(checkpoint.lastLineConsumed()).isEqualTo(40);
        assertThat(checkpoint.turnCount()).isEqualTo(6);
        assertThat(checkpoint.updatedAt()).isEqualTo(Instant.parse("2026-01-05T08:00:00Z"));
        assertThat(checkpoint.pendingTurn()).isFalse();
    }

    @Test
    void updateShouldKeepOtherSessions() throws Exception {
        Path path = tempDir.resolve("tracebridge_state.json");
        FileCheckpointStore store = new FileCheckpointStore(path);
        store.save(Map.of("a", new SessionCheckpoint(1, 1, Instant.EPOCH, false)));

        store.update("b", new SessionCheckpoint(5, 2, Instant.EPOCH, false));
        store.update("a", new SessionCheckpoint(9, 4, Instant.EPOCH, false));

        Map<String, SessionCheckpoint> loaded = store.load();
        assertThat(loaded).hasSize(2);
        assertThat(loaded.get("a").lastLineConsumed()).isEqualTo(9);
        assertThat(loaded.get("b").turnCount()).isEqualTo(2);
    }
}
