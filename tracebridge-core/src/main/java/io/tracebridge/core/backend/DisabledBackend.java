package io.tracebridge.core.backend;

import io.tracebridge.core.turn.Turn;

/**
 * Placeholder for a backend that is enabled but not usable (missing
 * credentials, invalid endpoint). Never healthy, so it never receives turns.
 */
public final class DisabledBackend implements TraceBackend {
    private final String name;
    private final String reason;

    public DisabledBackend(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "backend is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean healthCheck() {
        return false;
    }

    @Override
    public DeliveryResult emit(Turn turn) {
        return DeliveryResult.error("backend " + name + " is not configured (" + reason + ")");
    }
}
