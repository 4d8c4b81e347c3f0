package io.tracebridge.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.tracebridge.core.checkpoint.SessionCheckpoint;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldExtractProjectNameFromDirectoryName() {
        assertThat(SessionDiscovery.projectName("-Users-doneyli-djg-family-office")).isEqualTo("djg-family-office");
        assertThat(SessionDiscovery.projectName("-Users-john-my-project")).isEqualTo("my-project");
        assertThat(SessionDiscovery.projectName("-Users-alice-projects-web-app")).isEqualTo("projects-web-app");
        assertThat(SessionDiscovery.projectName("-Users-bob")).isEqualTo("-Users-bob");
        assertThat(SessionDiscovery.projectName("plain")).isEqualTo("plain");
    }

    @Test
    void shouldReturnChangedSessionsNewestFirstUpToCap() throws Exception {
        Instant base = Instant.parse("2026-03-01T10:00:00Z");
        transcript("-Users-alice-app-one", "old.jsonl", "old-session", base);
        transcript("-Users-alice-app-one", "mid.jsonl", "mid-session", base.plusSeconds(60));
        transcript("-Users-alice-app-two", "new.jsonl", "new-session", base.plusSeconds(120));

        List<SessionSource> sessions = new SessionDiscovery(tempDir).discover(Map.of(), 2);

        assertThat(sessions).extracting(SessionSource::sessionId).containsExactly("new-session", "mid-session");
        assertThat(sessions.get(0).project()).isEqualTo("app-two");
        assertThat(sessions.get(0).modifiedAt()).isEqualTo(base.plusSeconds(120));
    }

    @Test
    void shouldSkipSessionsNotModifiedSinceCheckpointUnlessTurnIsPending() throws Exception {
        Instant modified = Instant.parse("2026-03-01T10:00:00Z");
        transcript("-Users-alice-app", "a.jsonl", "a", modified);
        transcript("-Users-alice-app", "b.jsonl", "b", modified);
        transcript("-Users-alice-app", "c.jsonl", "c", modified);

        List<SessionSource> sessions = new SessionDiscovery(tempDir).discover(Map.of(
            "a", new SessionCheckpoint(4, 2, modified, false),
            "b", new SessionCheckpoint(4, 2, modified, true),
            "c", new SessionCheckpoint(4, 2, modified.minusSeconds(1), false)
        ), 10);

        assertThat(sessions).extracting(SessionSource::sessionId).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void shouldFallBackToFileNameWhenFirstLineHasNoSessionId() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("proj"));
        Files.writeString(dir.resolve("abc-123.jsonl"), "{\"type\":\"summary\"}\n");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        List<SessionSource> sessions = new SessionDiscovery(tempDir).discover(Map.of(), 10);

        assertThat(sessions).singleElement().satisfies(session -> {
            assertThat(session.sessionId()).isEqualTo("abc-123");
            assertThat(session.project()).isEqualTo("proj");
        });
    }

    @Test
    void shouldSkipTranscriptThatVanishesWhileScanning() throws Exception {
        Instant modified = Instant.parse("2026-03-01T10:00:00Z");
        transcript("-Users-alice-app", "gone.jsonl", "gone", modified);
        transcript("-Users-alice-app", "kept.jsonl", "kept", modified);
        SessionDiscovery discovery = new SessionDiscovery(tempDir, path -> {
            if (path.getFileName().toString().equals("gone.jsonl")) {
                throw new NoSuchFileException(path.toString());
            }
            return Files.getLastModifiedTime(path).toInstant();
        });

        List<SessionSource> sessions = discovery.discover(Map.of(), 10);

        assertThat(sessions).extracting(SessionSource::sessionId).containsExactly("kept");
    }

    @Test
    void shouldReturnNothingWhenProjectsDirectoryIsMissing() throws Exception {
        assertThat(new SessionDiscovery(tempDir.resolve("missing")).discover(Map.of(), 10)).isEmpty();
    }

    private void transcript(String projectDir, String fileName, String sessionId, Instant modifiedAt) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve(projectDir));
        Path file = dir.resolve(fileName);
        Files.writeString(file, "{\"sessionId\":\"" + sessionId + "\",\"type\":\"user\",\"message\":{\"content\":\"hi\"}}\n");
        Files.setLastModifiedTime(file, FileTime.from(modifiedAt));
    }
}
