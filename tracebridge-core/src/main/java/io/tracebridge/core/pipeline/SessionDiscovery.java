package io.tracebridge.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tracebridge.core.checkpoint.SessionCheckpoint;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds transcripts under {@code <projectsDir>/<project-dir>/*.jsonl} that
 * changed since their checkpoint, most recently modified first.
 */
public final class SessionDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(SessionDiscovery.class);
    private static final String TRANSCRIPT_SUFFIX = ".jsonl";

    private final Path projectsDir;
    private final ModifiedTime modifiedTime;
    private final ObjectMapper mapper = new ObjectMapper();

    public SessionDiscovery(Path projectsDir) {
        this(projectsDir, transcript -> Files.getLastModifiedTime(transcript).toInstant());
    }

    SessionDiscovery(Path projectsDir, ModifiedTime modifiedTime) {
        this.projectsDir = projectsDir;
        this.modifiedTime = modifiedTime;
    }

    /**
     * @param checkpoints known progress per session
     * @param maxSessions cap on returned sessions; the least recently modified excess waits for a later pass
     * @throws IOException when the projects directory itself cannot be listed; unreadable
     *                     project directories and transcripts are skipped
     */
    public List<SessionSource> discover(Map<String, SessionCheckpoint> checkpoints, int maxSessions) throws IOException {
        if (!Files.isDirectory(projectsDir)) {
            LOG.debug("Projects directory not found: {}", projectsDir);
            return List.of();
        }

        List<SessionSource> changed = new ArrayList<>();
        for (Path projectDir : listDirectories(projectsDir)) {
            String project = projectName(projectDir.getFileName().toString());
            List<Path> transcripts;
            try {
                transcripts = listTranscripts(projectDir);
            } catch (IOException e) {
                LOG.warn("Skipping unreadable project directory {}: {}", projectDir, e.getMessage());
                continue;
            }
            for (Path transcript : transcripts) {
                Instant modifiedAt;
                try {
                    modifiedAt = modifiedTime.of(transcript);
                } catch (IOException e) {
                    LOG.warn("Skipping transcript {}: {}", transcript, e.getMessage());
                    continue;
                }
                String sessionId = sessionIdOf(transcript);
                SessionCheckpoint checkpoint = checkpoints.get(sessionId);
                if (checkpoint == null || modifiedAt.isAfter(checkpoint.updatedAt()) || checkpoint.pendingTurn()) {
                    changed.add(new SessionSource(sessionId, project, transcript, modifiedAt));
                }
            }
        }

        changed.sort(Comparator.comparing(SessionSource::modifiedAt).reversed());
        if (changed.size() > maxSessions) {
            LOG.info("Deferring {} changed sessions to a later pass", changed.size() - maxSessions);
            return List.copyOf(changed.subList(0, maxSessions));
        }
        return List.copyOf(changed);
    }

    /**
     * Turns a directory name such as {@code -Users-alice-my-app} into {@code my-app}.
     * Names with three or fewer dash-separated parts are returned unchanged.
     */
    public static String projectName(String dirName) {
        String[] parts = dirName.split("-", -1);
        if (parts.length > 3) {
            return String.join("-", List.of(parts).subList(3, parts.length));
        }
        return dirName;
    }

    String sessionIdOf(Path transcript) {
        String fallback = transcript.getFileName().toString();
        fallback = fallback.substring(0, fallback.length() - TRANSCRIPT_SUFFIX.length());
        try (BufferedReader reader = Files.newBufferedReader(transcript, StandardCharsets.UTF_8)) {
            String firstLine = reader.readLine();
            if (firstLine == null || firstLine.isBlank()) {
                return fallback;
            }
            JsonNode first = mapper.readTree(firstLine);
            JsonNode sessionId = first == null ? null : first.get("sessionId");
            if (sessionId != null && sessionId.isTextual() && !sessionId.asText().isBlank()) {
                return sessionId.asText();
            }
        } catch (IOException e) {
            LOG.debug("Could not read session id from {}: {}", transcript, e.getMessage());
        }
        return fallback;
    }

    private List<Path> listDirectories(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        }
    }

    private List<Path> listTranscripts(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(TRANSCRIPT_SUFFIX))
                .sorted()
                .toList();
        }
    }

    @FunctionalInterface
    interface ModifiedTime {
        Instant of(Path transcript) throws IOException;
    }
}
