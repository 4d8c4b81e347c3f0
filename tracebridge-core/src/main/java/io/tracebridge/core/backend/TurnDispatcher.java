package io.tracebridge.core.backend;

import io.tracebridge.core.turn.Turn;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a turn out to every backend. A failing backend is logged and skipped;
 * it never prevents delivery to the others.
 */
public final class TurnDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(TurnDispatcher.class);

    public DispatchOutcome dispatch(Turn turn, List<TraceBackend> backends) {
        int delivered = 0;
        List<String> failures = new ArrayList<>();
        for (TraceBackend backend : backends) {
            DeliveryResult result;
            try {
                result = backend.emit(turn);
            } catch (RuntimeException e) {
                result = DeliveryResult.error(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.success()) {
                delivered++;
                LOG.debug("Delivered turn {} of session {} to {}", turn.turnNumber(), turn.sessionId(), backend.name());
            } else {
                failures.add(backend.name() + ": " + result.message());
                LOG.warn(
                    "Backend {} failed turn {} of session {}: {}",
                    backend.name(),
                    turn.turnNumber(),
                    turn.sessionId(),
                    truncate(result.message(), 300)
                );
            }
        }
        return new DispatchOutcome(delivered, failures);
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
