package io.tracebridge.core.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tracebridge.core.turn.Turn;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-delimited JSON queue; each line is a turn payload plus {@code queuedAt}.
 * <p>
 * Lines that {@link #loadAll()} cannot read are kept out of the queue and, on
 * the next rewrite, appended to a {@code .rejected} file next to it.
 */
public final class FileDeliveryQueue implements DeliveryQueue {
    private static final Logger LOG = LoggerFactory.getLogger(FileDeliveryQueue.class);
    private static final String QUEUED_AT = "queuedAt";
    private static final String REJECTED_SUFFIX = ".rejected";

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final List<String> unreadable = new ArrayList<>();

    public FileDeliveryQueue(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized void enqueue(Turn turn) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            String line = toLine(new QueuedTurn(turn, clock.instant()));
            Files.writeString(
                path,
                line + "\n",
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
            LOG.debug("Queued turn {} of session {}", turn.turnNumber(), turn.sessionId());
        } catch (IOException e) {
            LOG.error("Failed to queue turn {} of session {}: {}", turn.turnNumber(), turn.sessionId(), e.getMessage());
        }
    }

    @Override
    public synchronized List<QueuedTurn> loadAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<QueuedTurn> queued = new ArrayList<>();
        unreadable.clear();
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                queued.add(fromLine(line));
            } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
                unreadable.add(line);
                LOG.error("Unreadable queue entry at line {} of {}: {}", i + 1, path, e.getMessage());
            }
        }
        return queued;
    }

    @Override
    public synchronized void replace(List<QueuedTurn> remaining) throws IOException {
        quarantineUnreadable();
        if (remaining.isEmpty()) {
            clear();
            return;
        }
        StringBuilder content = new StringBuilder();
        for (QueuedTurn queuedTurn : remaining) {
            content.append(toLine(queuedTurn)).append('\n');
        }
        Files.createDirectories(path.toAbsolutePath().getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, content.toString(), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public synchronized void clear() throws IOException {
        quarantineUnreadable();
        Files.deleteIfExists(path);
    }

    Path rejectedPath() {
        return path.resolveSibling(path.getFileName() + REJECTED_SUFFIX);
    }

    private void quarantineUnreadable() throws IOException {
        if (unreadable.isEmpty()) {
            return;
        }
        Files.createDirectories(path.toAbsolutePath().getParent());
        Files.write(
            rejectedPath(),
            unreadable,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
        LOG.error("Moved {} unreadable queue entries to {}", unreadable.size(), rejectedPath());
        unreadable.clear();
    }

    private String toLine(QueuedTurn queuedTurn) throws IOException {
        ObjectNode node = mapper.valueToTree(queuedTurn.turn());
        node.put(QUEUED_AT, queuedTurn.queuedAt().toString());
        return mapper.writeValueAsString(node);
    }

    private QueuedTurn fromLine(String line) throws IOException {
        JsonNode node = mapper.readTree(line);
        if (!(node instanceof ObjectNode object)) {
            throw new IllegalArgumentException("queue entry is not a JSON object");
        }
        JsonNode queuedAt = object.remove(QUEUED_AT);
        Instant instant = queuedAt == null || !queuedAt.isTextual() ? Instant.EPOCH : Instant.parse(queuedAt.asText());
        return new QueuedTurn(mapper.treeToValue(object, Turn.class), instant);
    }
}
