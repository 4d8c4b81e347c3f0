package io.tracebridge.core.checkpoint;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Durable progress marker for one session.
 *
 * @param lastLineConsumed count of transcript lines folded into turns or discarded
 * @param turnCount        cumulative turns delivered or queued
 * @param updatedAt        when the marker was last written; compared against transcript mtime
 * @param pendingTurn      a trailing turn was held back and must be revisited even if
 *                         the transcript is not modified again
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCheckpoint(
    @JsonAlias({"last_line"}) long lastLineConsumed,
    @JsonAlias({"turn_count"}) int turnCount,
    @JsonAlias({"updated"}) Instant updatedAt,
    boolean pendingTurn
) {
    public SessionCheckpoint {
        lastLineConsumed = Math.max(0, lastLineConsumed);
        turnCount = Math.max(0, turnCount);
        updatedAt = updatedAt == null ? Instant.EPOCH : updatedAt;
    }

    public static SessionCheckpoint initial() {
        return new SessionCheckpoint(0, 0, Instant.EPOCH, false);
    }
}
