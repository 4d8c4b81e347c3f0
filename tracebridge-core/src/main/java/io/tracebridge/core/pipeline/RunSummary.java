package io.tracebridge.core.pipeline;

import java.time.Duration;

/**
 * Outcome of one pass.
 *
 * @param turnsDelivered newly assembled turns handed to healthy backends
 * @param turnsQueued    newly assembled turns written to the delivery queue
 * @param turnsDrained   previously queued turns delivered during this pass
 */
public record RunSummary(
    int sessionsProcessed,
    int turnsDelivered,
    int turnsQueued,
    int turnsDrained,
    int healthyBackends,
    Duration elapsed
) {
    public static RunSummary idle(Duration elapsed) {
        return new RunSummary(0, 0, 0, 0, 0, elapsed);
    }

    public String describe() {
        return "sessions=" + sessionsProcessed
            + " delivered=" + turnsDelivered
            + " queued=" + turnsQueued
            + " drained=" + turnsDrained
            + " healthyBackends=" + healthyBackends
            + " elapsed=" + elapsed.toMillis() + "ms";
    }
}
