package io.tracebridge.core.backend;

import java.util.List;

public record DispatchOutcome(int delivered, List<String> failures) {

    public DispatchOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean anyDelivered() {
        return delivered > 0;
    }
}
