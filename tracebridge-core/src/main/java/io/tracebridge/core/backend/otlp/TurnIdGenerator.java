package io.tracebridge.core.backend.otlp;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;
import io.opentelemetry.sdk.trace.IdGenerator;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives trace and span ids from the turn being exported, so exporting the
 * same turn again reuses the same ids. The trace id is the same name-based
 * UUID the Langfuse backend uses for its trace.
 * <p>
 * Callers {@link #assign} a role before starting each span and {@link #clear}
 * afterwards; outside an assignment ids are random.
 */
final class TurnIdGenerator implements IdGenerator {
    private static final IdGenerator RANDOM = IdGenerator.random();

    private final ThreadLocal<String> turnKey = new ThreadLocal<>();
    private final ThreadLocal<String> role = new ThreadLocal<>();

    /**
     * @param turnKey {@code sessionId:turnNumber}
     * @param role    span role within the turn, e.g. {@code root} or {@code tool:0:toolu_1}
     */
    void assign(String turnKey, String role) {
        this.turnKey.set(turnKey);
        this.role.set(role);
    }

    void clear() {
        turnKey.remove();
        role.remove();
    }

    @Override
    public String generateTraceId() {
        String key = turnKey.get();
        if (key == null) {
            return RANDOM.generateTraceId();
        }
        UUID uuid = uuid(key + ":trace");
        long high = uuid.getMostSignificantBits();
        long low = uuid.getLeastSignificantBits();
        return TraceId.fromLongs(high, low == 0 && high == 0 ? 1 : low);
    }

    @Override
    public String generateSpanId() {
        String key = turnKey.get();
        if (key == null || role.get() == null) {
            return RANDOM.generateSpanId();
        }
        long id = uuid(key + ":" + role.get()).getMostSignificantBits();
        return SpanId.fromLong(id == 0 ? 1 : id);
    }

    private static UUID uuid(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
