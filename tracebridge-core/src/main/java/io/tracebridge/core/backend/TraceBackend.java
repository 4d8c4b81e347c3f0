package io.tracebridge.core.backend;

import io.tracebridge.core.turn.Turn;

/**
 * A telemetry sink that renders a {@link Turn} as a span tree.
 * <p>
 * Delivery is at-least-once: the same turn may be emitted again after a
 * crash or a queue replay, so implementations must tolerate duplicates.
 */
public interface TraceBackend extends AutoCloseable {
    String name();

    /**
     * Cheap reachability probe, run once per invocation before any emit.
     */
    boolean healthCheck();

    DeliveryResult emit(Turn turn);

    default void flush() {
    }

    @Override
    default void close() {
    }
}
