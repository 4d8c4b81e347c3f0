package io.tracebridge.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.tracebridge.core.backend.DeliveryResult;
import io.tracebridge.core.backend.TraceBackend;
import io.tracebridge.core.backend.TurnDispatcher;
import io.tracebridge.core.checkpoint.FileCheckpointStore;
import io.tracebridge.core.checkpoint.SessionCheckpoint;
import io.tracebridge.core.config.model.PipelineConfig;
import io.tracebridge.core.queue.FileDeliveryQueue;
import io.tracebridge.core.transcript.RecordContent;
import io.tracebridge.core.transcript.TranscriptParser;
import io.tracebridge.core.transcript.TranscriptReader;
import io.tracebridge.core.turn.Turn;
import io.tracebridge.core.turn.TurnAssembler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TracePipelineTest {
    private static final Instant WRITTEN_AT = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path projects;
    private Path state;
    private Path transcript;
    private Clock clock;

    @BeforeEach
    void setUp() throws Exception {
        projects = tempDir.resolve("projects");
        state = tempDir.resolve("state");
        transcript = Files.createDirectories(projects.resolve("-Users-alice-my-app")).resolve("file-stem.jsonl");
        clock = Clock.fixed(WRITTEN_AT.plusSeconds(600), ZoneOffset.UTC);
    }

    @Test
    void shouldDeliverNewTurnsAndAdvanceCheckpoint() throws Exception {
        write(0, user("A"), assistant("m1", "one"), user("B"), assistant("m2", "two"));
        StubBackend backend = new StubBackend("langfuse", true);

        RunSummary summary = pipeline(defaults(), backend).run();

        assertThat(summary.turnsDelivered()).isEqualTo(2);
        assertThat(summary.sessionsProcessed()).isEqualTo(1);
        assertThat(backend.emitted).extracting(Turn::turnNumber).containsExactly(1, 2);
        assertThat(backend.emitted.get(0).sessionId()).isEqualTo("sess-1");
        assertThat(backend.emitted.get(0).project()).isEqualTo("my-app");
        assertThat(backend.closed).isTrue();

        SessionCheckpoint checkpoint = checkpoints().load().get("sess-1");
        assertThat(checkpoint.lastLineConsumed()).isEqualTo(4);
        assertThat(checkpoint.turnCount()).isEqualTo(2);
        assertThat(checkpoint.updatedAt()).isEqualTo(WRITTEN_AT);
        assertThat(checkpoint.pendingTurn()).isFalse();
    }

    @Test
    void shouldNotReprocessUnchangedSession() throws Exception {
        write(0, user("A"), assistant("m1", "one"));
        pipeline(defaults(), new StubBackend("langfuse", true)).run();
        StubBackend second = new StubBackend("langfuse", true);

        RunSummary summary = pipeline(defaults(), second).run();

        assertThat(summary.sessionsProcessed()).isZero();
        assertThat(second.emitted).isEmpty();
    }

    @Test
    void shouldQueueWhileBackendsAreDownAndDrainFirstOnRecovery() throws Exception {
        write(0, user("A"), assistant("m1", "one"), user("B"), assistant("m2", "two"));
        StubBackend down = new StubBackend("langfuse", false);

        RunSummary outage = pipeline(defaults(), down).run();

        assertThat(outage.turnsQueued()).isEqualTo(2);
        assertThat(outage.healthyBackends()).isZero();
        assertThat(down.emitted).isEmpty();
        assertThat(queue().loadAll()).extracting(queued -> queued.turn().turnNumber()).containsExactly(1, 2);
        assertThat(checkpoints().load().get("sess-1").turnCount()).isEqualTo(2);

        write(60, user("C"), assistant("m3", "three"));
        StubBackend up = new StubBackend("langfuse", true);

        RunSummary recovery = pipeline(defaults(), up).run();

        assertThat(recovery.turnsDrained()).isEqualTo(2);
        assertThat(recovery.turnsDelivered()).isEqualTo(1);
        assertThat(up.emitted).extracting(Turn::turnNumber).containsExactly(1, 2, 3);
        assertThat(queue().loadAll()).isEmpty();
        assertThat(Files.exists(state.resolve("pending_traces.jsonl"))).isFalse();
    }

    @Test
    void shouldOnlyEmitToHealthyBackends() throws Exception {
        write(0, user("A"), assistant("m1", "one"));
        StubBackend healthy = new StubBackend("otlp", true);
        StubBackend unhealthy = new StubBackend("langfuse", false);

        RunSummary summary = pipeline(defaults(), unhealthy, healthy).run();

        assertThat(summary.healthyBackends()).isEqualTo(1);
        assertThat(healthy.emitted).hasSize(1);
        assertThat(unhealthy.emitted).isEmpty();
        assertThat(queue().loadAll()).isEmpty();
        assertThat(unhealthy.closed).isTrue();
    }

    @Test
    void shouldAdvanceCheckpointEvenWhenHealthyBackendRejectsTurn() throws Exception {
        write(0, user("A"), assistant("m1", "one"));
        StubBackend rejecting = new StubBackend("langfuse", true);
        rejecting.reject = true;

        pipeline(defaults(), rejecting).run();

        assertThat(rejecting.emitted).hasSize(1);
        assertThat(checkpoints().load().get("sess-1").turnCount()).isEqualTo(1);
        assertThat(queue().loadAll()).isEmpty();
    }

    @Test
    void shouldResumeAtUnansweredUserMessageAndKeepNumbering() throws Exception {
        write(0, user("A"), assistant("m1", "one"), user("B"));
        StubBackend first = new StubBackend("langfuse", true);

        pipeline(defaults(), first).run();

        assertThat(first.emitted).extracting(Turn::turnNumber).containsExactly(1);
        SessionCheckpoint checkpoint = checkpoints().load().get("sess-1");
        assertThat(checkpoint.lastLineConsumed()).isEqualTo(2);
        assertThat(checkpoint.turnCount()).isEqualTo(1);

        write(60, assistant("m2", "two"));
        StubBackend second = new StubBackend("langfuse", true);

        pipeline(defaults(), second).run();

        assertThat(second.emitted).singleElement().satisfies(turn -> {
            assertThat(turn.turnNumber()).isEqualTo(2);
            assertThat(RecordContent.textOf(turn.userMessage())).isEqualTo("B");
        });
        assertThat(checkpoints().load().get("sess-1").lastLineConsumed()).isEqualTo(4);
    }

    @Test
    void shouldHoldBackTrailingTurnUntilTranscriptSettles() throws Exception {
        PipelineConfig settling = new PipelineConfig(10, 2000, 180, 900, true, false);
        write(0, user("A"), assistant("m1", "partial"));
        StubBackend early = new StubBackend("langfuse", true);

        pipeline(settling, early).run();

        assertThat(early.emitted).isEmpty();
        SessionCheckpoint held = checkpoints().load().get("sess-1");
        assertThat(held.pendingTurn()).isTrue();
        assertThat(held.lastLineConsumed()).isZero();
        assertThat(held.turnCount()).isZero();

        clock = Clock.fixed(WRITTEN_AT.plusSeconds(1000), ZoneOffset.UTC);
        StubBackend late = new StubBackend("langfuse", true);

        pipeline(settling, late).run();

        assertThat(late.emitted).singleElement().satisfies(turn -> assertThat(turn.turnNumber()).isEqualTo(1));
        assertThat(checkpoints().load().get("sess-1").pendingTurn()).isFalse();
    }

    @Test
    void shouldKeepStreamingResponseTogetherWithDefaultSettings() throws Exception {
        write(0, user("A"), assistant("m1", "partial"));
        clock = Clock.fixed(WRITTEN_AT.plusSeconds(10), ZoneOffset.UTC);
        StubBackend first = new StubBackend("langfuse", true);

        pipeline(defaults(), first).run();

        assertThat(first.emitted).isEmpty();
        assertThat(checkpoints().load().get("sess-1").pendingTurn()).isTrue();

        write(20, assistant("m1", " rest"), assistant("m2", "final answer"), user("B"), assistant("m3", "b"));
        clock = Clock.fixed(WRITTEN_AT.plusSeconds(30), ZoneOffset.UTC);
        StubBackend second = new StubBackend("langfuse", true);

        pipeline(defaults(), second).run();

        assertThat(second.emitted).singleElement().satisfies(turn -> {
            assertThat(turn.turnNumber()).isEqualTo(1);
            assertThat(turn.assistantMessages())
                .extracting(RecordContent::textOf)
                .containsExactly("partial\n rest", "final answer");
        });
        SessionCheckpoint held = checkpoints().load().get("sess-1");
        assertThat(held.lastLineConsumed()).isEqualTo(4);
        assertThat(held.turnCount()).isEqualTo(1);
        assertThat(held.pendingTurn()).isTrue();

        clock = Clock.fixed(WRITTEN_AT.plusSeconds(20 + 301), ZoneOffset.UTC);
        StubBackend third = new StubBackend("langfuse", true);

        pipeline(defaults(), third).run();

        assertThat(third.emitted).singleElement().satisfies(turn -> {
            assertThat(turn.turnNumber()).isEqualTo(2);
            assertThat(RecordContent.textOf(turn.userMessage())).isEqualTo("B");
        });
        assertThat(checkpoints().load().get("sess-1").pendingTurn()).isFalse();
    }

    @Test
    void shouldDoNothingWithoutEnabledBackends() throws Exception {
        write(0, user("A"), assistant("m1", "one"));

        RunSummary summary = pipeline(defaults()).run();

        assertThat(summary).isEqualTo(RunSummary.idle(Duration.ZERO));
        assertThat(Files.exists(state.resolve("tracebridge_state.json"))).isFalse();
    }

    @Test
    void drainOnlyShouldReplayQueueWithoutReadingTranscripts() throws Exception {
        write(0, user("A"), assistant("m1", "one"));
        pipeline(defaults(), new StubBackend("langfuse", false)).run();
        write(60, user("B"), assistant("m2", "two"));
        StubBackend up = new StubBackend("langfuse", true);

        RunSummary summary = pipeline(defaults(), up).drainOnly();

        assertThat(summary.turnsDrained()).isEqualTo(1);
        assertThat(summary.turnsDelivered()).isZero();
        assertThat(up.emitted).extracting(Turn::turnNumber).containsExactly(1);
        assertThat(checkpoints().load().get("sess-1").turnCount()).isEqualTo(1);
    }

    @Test
    void shouldSurviveBackendThatThrowsDuringHealthCheck() throws Exception {
        write(0, user("A"), assistant("m1", "one"));
        StubBackend broken = new StubBackend("otlp", true);
        broken.healthFailure = new IllegalStateException("resolver down");

        RunSummary summary = pipeline(defaults(), broken).run();

        assertThat(summary.turnsQueued()).isEqualTo(1);
        assertThat(broken.emitted).isEmpty();
    }

    private TracePipeline pipeline(PipelineConfig settings, TraceBackend... backends) {
        return new TracePipeline(
            settings,
            new SessionDiscovery(projects),
            new TranscriptReader(new TranscriptParser()),
            new TurnAssembler(),
            checkpoints(),
            queue(),
            new TurnDispatcher(),
            List.of(backends),
            clock
        );
    }

    private static PipelineConfig defaults() {
        return PipelineConfig.defaults();
    }

    private FileCheckpointStore checkpoints() {
        return new FileCheckpointStore(state.resolve("tracebridge_state.json"));
    }

    private FileDeliveryQueue queue() {
        return new FileDeliveryQueue(state.resolve("pending_traces.jsonl"), clock);
    }

    private void write(long secondsAfterStart, String... lines) throws Exception {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        Files.writeString(
            transcript,
            content.toString(),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
        Files.setLastModifiedTime(transcript, FileTime.from(WRITTEN_AT.plusSeconds(secondsAfterStart)));
    }

    private static String user(String text) {
        return "{\"sessionId\":\"sess-1\",\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"" + text + "\"}}";
    }

    private static String assistant(String messageId, String text) {
        return "{\"sessionId\":\"sess-1\",\"type\":\"assistant\",\"message\":{\"id\":\"" + messageId
            + "\",\"content\":[{\"type\":\"text\",\"text\":\"" + text + "\"}]}}";
    }

    private static final class StubBackend implements TraceBackend {
        private final String name;
        private final boolean healthy;
        private final List<Turn> emitted = new ArrayList<>();
        private boolean reject;
        private RuntimeException healthFailure;
        private boolean closed;

        StubBackend(String name, boolean healthy) {
            this.name = name;
            this.healthy = healthy;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean healthCheck() {
            if (healthFailure != null) {
                throw healthFailure;
            }
            return healthy;
        }

        @Override
        public DeliveryResult emit(Turn turn) {
            emitted.add(turn);
            return reject ? DeliveryResult.error("HTTP 400") : DeliveryResult.ok();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
