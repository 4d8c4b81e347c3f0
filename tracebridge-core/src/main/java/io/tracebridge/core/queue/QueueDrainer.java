package io.tracebridge.core.queue;

import io.tracebridge.core.backend.TraceBackend;
import io.tracebridge.core.backend.TurnDispatcher;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays queued turns to healthy backends.
 * <p>
 * After each turn is dispatched the queue is rewritten to hold only the
 * turns after it, so an interruption at any point leaves every undelivered
 * turn queued in its original order and redelivers at most one.
 */
public final class QueueDrainer {
    private static final Logger LOG = LoggerFactory.getLogger(QueueDrainer.class);

    private final DeliveryQueue queue;
    private final TurnDispatcher dispatcher;

    public QueueDrainer(DeliveryQueue queue, TurnDispatcher dispatcher) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * @return number of queued turns delivered and removed from the queue
     */
    public int drain(List<TraceBackend> backends) {
        if (backends.isEmpty()) {
            return 0;
        }
        List<QueuedTurn> queued;
        try {
            queued = queue.loadAll();
        } catch (IOException e) {
            LOG.error("Could not read delivery queue, leaving it untouched: {}", e.getMessage());
            return 0;
        }
        if (queued.isEmpty()) {
            return 0;
        }

        LOG.info("Draining {} queued turns to {} backends", queued.size(), backends.size());
        int committed = 0;
        try {
            for (int i = 0; i < queued.size(); i++) {
                dispatcher.dispatch(queued.get(i).turn(), backends);
                queue.replace(queued.subList(i + 1, queued.size()));
                committed = i + 1;
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Drain aborted after {} of {} turns: {}", committed, queued.size(), e.getMessage());
            requeue(queued.subList(committed, queued.size()));
        }
        return committed;
    }

    private void requeue(List<QueuedTurn> remaining) {
        try {
            queue.replace(remaining);
        } catch (IOException e) {
            LOG.error("Could not rewrite delivery queue with {} remaining turns: {}", remaining.size(), e.getMessage());
        }
    }
}
