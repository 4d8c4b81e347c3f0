package io.tracebridge.core.turn;

import java.util.List;
import java.util.Optional;

public record AssemblyResult(List<Turn> turns, Optional<PendingTurn> pending) {

    public AssemblyResult {
        turns = turns == null ? List.of() : List.copyOf(turns);
        pending = pending == null ? Optional.empty() : pending;
    }
}
