package io.tracebridge.core.queue;

import io.tracebridge.core.turn.Turn;
import java.io.IOException;
import java.util.List;

/**
 * Durable FIFO of turns that could not be handed to any backend.
 */
public interface DeliveryQueue {
    /**
     * Appends a turn. Never throws: an I/O failure is logged and the turn is lost.
     */
    void enqueue(Turn turn);

    /**
     * Returns queued turns in insertion order.
     */
    List<QueuedTurn> loadAll() throws IOException;

    /**
     * Atomically replaces the queue content with {@code remaining}, in order.
     */
    void replace(List<QueuedTurn> remaining) throws IOException;

    void clear() throws IOException;
}
