package io.tracebridge.core.queue;

import io.tracebridge.core.turn.Turn;
import java.time.Instant;
import java.util.Objects;

public record QueuedTurn(Turn turn, Instant queuedAt) {

    public QueuedTurn {
        Objects.requireNonNull(turn, "turn must not be null");
        queuedAt = queuedAt == null ? Instant.EPOCH : queuedAt;
    }
}
