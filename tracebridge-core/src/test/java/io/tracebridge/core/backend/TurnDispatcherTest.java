package io.tracebridge.core.backend;

import static org.assertj.core.api.Assertions.assertThat;

import io.tracebridge.core.turn.Turn;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TurnDispatcherTest {

    @Test
    void shouldDeliverToAllBackendsEvenWhenOneFailsOrThrows() {
        List<String> calls = new ArrayList<>();
        TraceBackend throwing = new StubBackend("boom", calls, () -> {
            throw new IllegalStateException("socket closed");
        });
        TraceBackend rejecting = new StubBackend("reject", calls, () -> DeliveryResult.error("HTTP 400"));
        TraceBackend accepting = new StubBackend("ok", calls, DeliveryResult::ok);

        DispatchOutcome outcome = new TurnDispatcher().dispatch(
            TurnFixtures.plainTurn("s", 1),
            List.of(throwing, rejecting, accepting)
        );

        assertThat(calls).containsExactly("boom", "reject", "ok");
        assertThat(outcome.delivered()).isEqualTo(1);
        assertThat(outcome.anyDelivered()).isTrue();
        assertThat(outcome.failures()).hasSize(2);
        assertThat(outcome.failures().get(0)).startsWith("boom: IllegalStateException");
        assertThat(outcome.failures().get(1)).isEqualTo("reject: HTTP 400");
    }

    @Test
    void disabledBackendShouldNeverBeHealthyAndRejectTurns() {
        DisabledBackend backend = new DisabledBackend("langfuse", "missing keys");

        assertThat(backend.healthCheck()).isFalse();
        assertThat(backend.emit(TurnFixtures.plainTurn("s", 1)).success()).isFalse();
        assertThat(backend.reason()).isEqualTo("missing keys");
    }

    private record StubBackend(String name, List<String> calls, java.util.function.Supplier<DeliveryResult> result)
        implements TraceBackend {

        @Override
        public boolean healthCheck() {
            return true;
        }

        @Override
        public DeliveryResult emit(Turn turn) {
            calls.add(name);
            return result.get();
        }
    }
}
