package io.tracebridge.core.pipeline;

import io.tracebridge.core.backend.BackendFactory;
import io.tracebridge.core.backend.DispatchOutcome;
import io.tracebridge.core.backend.TraceBackend;
import io.tracebridge.core.backend.TurnDispatcher;
import io.tracebridge.core.backend.TurnTraceBuilder;
import io.tracebridge.core.checkpoint.CheckpointStore;
import io.tracebridge.core.checkpoint.FileCheckpointStore;
import io.tracebridge.core.checkpoint.SessionCheckpoint;
import io.tracebridge.core.config.ConfigPaths;
import io.tracebridge.core.config.model.PipelineConfig;
import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.middleware.SecretRedactor;
import io.tracebridge.core.queue.DeliveryQueue;
import io.tracebridge.core.queue.FileDeliveryQueue;
import io.tracebridge.core.queue.QueueDrainer;
import io.tracebridge.core.transcript.TranscriptParser;
import io.tracebridge.core.transcript.TranscriptReader;
import io.tracebridge.core.transcript.TranscriptSlice;
import io.tracebridge.core.turn.AssemblyResult;
import io.tracebridge.core.turn.PendingTurn;
import io.tracebridge.core.turn.Turn;
import io.tracebridge.core.turn.TurnAssembler;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One finite pass from transcripts to backends:
 * discover changed sessions, probe backends, drain the queue when something
 * is healthy, deliver or queue new turns, advance checkpoints, then flush and
 * close every backend.
 * <p>
 * A checkpoint is written only after the session's turns were handed to the
 * backends or the queue. A pipeline owns its backends and is used for a
 * single pass.
 */
public final class TracePipeline {
    private static final Logger LOG = LoggerFactory.getLogger(TracePipeline.class);

    private final PipelineConfig settings;
    private final SessionDiscovery discovery;
    private final TranscriptReader reader;
    private final TurnAssembler assembler;
    private final CheckpointStore checkpoints;
    private final DeliveryQueue queue;
    private final TurnDispatcher dispatcher;
    private final QueueDrainer drainer;
    private final List<TraceBackend> backends;
    private final Clock clock;

    public TracePipeline(
        PipelineConfig settings,
        SessionDiscovery discovery,
        TranscriptReader reader,
        TurnAssembler assembler,
        CheckpointStore checkpoints,
        DeliveryQueue queue,
        TurnDispatcher dispatcher,
        List<TraceBackend> backends,
        Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.drainer = new QueueDrainer(queue, dispatcher);
        this.backends = backends == null ? List.of() : List.copyOf(backends);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wires file-backed stores and the enabled backends from a resolved configuration.
     */
    public static TracePipeline fromConfig(TracebridgeConfig config, Clock clock) {
        SecretRedactor redactor = new SecretRedactor(config.pipeline().redactSecrets());
        List<TraceBackend> backends = new BackendFactory(new TurnTraceBuilder(redactor, clock)).create(config);
        return new TracePipeline(
            config.pipeline(),
            new SessionDiscovery(ConfigPaths.projectsDir(config)),
            new TranscriptReader(new TranscriptParser()),
            new TurnAssembler(),
            new FileCheckpointStore(ConfigPaths.checkpointFile(config)),
            new FileDeliveryQueue(ConfigPaths.queueFile(config), clock),
            new TurnDispatcher(),
            backends,
            clock
        );
    }

    /**
     * Runs a full pass. Never throws; failures are logged and reflected in the summary.
     */
    public RunSummary run() {
        Instant started = clock.instant();
        if (backends.isEmpty()) {
            LOG.info("No trace backend enabled, nothing to do");
            return RunSummary.idle(Duration.ZERO);
        }

        Tally tally = new Tally();
        try {
            Map<String, SessionCheckpoint> known = checkpoints.load();
            List<SessionSource> sessions = discovery.discover(known, settings.maxSessionsPerRun());
            List<TraceBackend> healthy = healthyBackends();
            tally.healthyBackends = healthy.size();
            if (healthy.isEmpty()) {
                LOG.warn("No healthy backend, queueing turns from {} sessions", sessions.size());
            } else {
                tally.drained = drainer.drain(healthy);
            }
            for (SessionSource session : sessions) {
                processSession(session, known.getOrDefault(session.sessionId(), SessionCheckpoint.initial()), healthy, tally);
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Trace pass aborted: {}", e.getMessage(), e);
        } finally {
            shutdownBackends();
        }
        return finish(started, tally);
    }

    /**
     * Probes the backends and replays the queue only, without reading transcripts.
     */
    public RunSummary drainOnly() {
        Instant started = clock.instant();
        Tally tally = new Tally();
        try {
            List<TraceBackend> healthy = healthyBackends();
            tally.healthyBackends = healthy.size();
            if (healthy.isEmpty()) {
                LOG.warn("No healthy backend, queue left as is");
            } else {
                tally.drained = drainer.drain(healthy);
            }
        } catch (RuntimeException e) {
            LOG.error("Queue drain aborted: {}", e.getMessage(), e);
        } finally {
            shutdownBackends();
        }
        return finish(started, tally);
    }

    private void processSession(SessionSource session, SessionCheckpoint checkpoint, List<TraceBackend> healthy, Tally tally) {
        String sessionId = session.sessionId();
        TranscriptSlice slice;
        try {
            slice = reader.read(session.transcript(), checkpoint.lastLineConsumed());
        } catch (IOException e) {
            LOG.error("Could not read transcript {} for session {}: {}", session.transcript(), sessionId, e.getMessage());
            return;
        }

        boolean settled = !session.modifiedAt().plus(settings.trailingTurnSettle()).isAfter(clock.instant());
        AssemblyResult result = assembler.assemble(
            sessionId,
            session.project(),
            slice.records(),
            checkpoint.turnCount(),
            settled
        );

        for (Turn turn : result.turns()) {
            if (healthy.isEmpty()) {
                queue.enqueue(turn);
                tally.queued++;
            } else {
                DispatchOutcome outcome = dispatcher.dispatch(turn, healthy);
                if (!outcome.anyDelivered()) {
                    LOG.warn("Turn {} of session {} was rejected by every backend", turn.turnNumber(), sessionId);
                }
                tally.delivered++;
            }
        }

        long consumed = result.pending().map(PendingTurn::startLine).orElse(slice.completeLines());
        boolean pendingTurn = result.pending().map(PendingTurn::hasAssistantOutput).orElse(false);
        SessionCheckpoint advanced = new SessionCheckpoint(
            Math.max(checkpoint.lastLineConsumed(), consumed),
            checkpoint.turnCount() + result.turns().size(),
            session.modifiedAt(),
            pendingTurn
        );
        try {
            checkpoints.update(sessionId, advanced);
            tally.sessions++;
            LOG.debug(
                "Session {} advanced to line {} with {} turns",
                sessionId,
                advanced.lastLineConsumed(),
                advanced.turnCount()
            );
        } catch (IOException e) {
            LOG.error("Could not save checkpoint for session {}: {}", sessionId, e.getMessage());
        }
    }

    private List<TraceBackend> healthyBackends() {
        List<TraceBackend> healthy = new ArrayList<>();
        for (TraceBackend backend : backends) {
            boolean up;
            try {
                up = backend.healthCheck();
            } catch (RuntimeException e) {
                LOG.debug("Health check of {} threw", backend.name(), e);
                up = false;
            }
            if (up) {
                healthy.add(backend);
            } else {
                LOG.warn("Backend {} is not healthy for this run", backend.name());
            }
        }
        return healthy;
    }

    private void shutdownBackends() {
        for (TraceBackend backend : backends) {
            try {
                backend.flush();
                backend.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to shut down backend {}: {}", backend.name(), e.getMessage());
            }
        }
    }

    private RunSummary finish(Instant started, Tally tally) {
        Duration elapsed = Duration.between(started, clock.instant());
        RunSummary summary = new RunSummary(
            tally.sessions,
            tally.delivered,
            tally.queued,
            tally.drained,
            tally.healthyBackends,
            elapsed
        );
        LOG.info("Trace pass finished: {}", summary.describe());
        if (elapsed.compareTo(settings.slowRunWarning()) > 0) {
            LOG.warn("Trace pass took {}s, longer than {}s", elapsed.toSeconds(), settings.slowRunWarning().toSeconds());
        }
        return summary;
    }

    private static final class Tally {
        private int sessions;
        private int delivered;
        private int queued;
        private int drained;
        private int healthyBackends;
    }
}
