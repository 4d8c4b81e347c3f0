package io.tracebridge.core.turn;

import com.fasterxml.jackson.databind.JsonNode;
import io.tracebridge.core.transcript.RecordContent;
import io.tracebridge.core.transcript.TranscriptRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups an ordered run of transcript records into {@link Turn}s.
 * <p>
 * A turn opens with a genuine user record and closes when the next one
 * arrives. Tool-result carriers never open a turn: they are attached to
 * whichever turn is open when they are read, even if the matching tool call
 * belongs to an earlier turn. Consecutive assistant records sharing a
 * {@code message.id} are merged into one message; records without an id are
 * standalone messages.
 * <p>
 * The assembler holds no state between calls, so re-assembling the same
 * records from the same starting count yields the same turns.
 */
public final class TurnAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(TurnAssembler.class);

    /**
     * @param sessionId            session the records belong to
     * @param project              project tag stamped on each turn
     * @param records              records read since the checkpoint, in file order
     * @param turnCount            turns already delivered for the session
     * @param finalizeTrailingTurn whether a trailing turn with assistant output may be
     *                             emitted at end of input; when false it is reported as pending
     */
    public AssemblyResult assemble(
        String sessionId,
        String project,
        List<TranscriptRecord> records,
        int turnCount,
        boolean finalizeTrailingTurn
    ) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Accumulator acc = new Accumulator(sessionId, project, turnCount);

        for (TranscriptRecord record : records) {
            switch (record.kind()) {
                case TOOL_RESULT -> acc.toolResults.add(record.raw());
                case USER -> acc.startTurn(record);
                case ASSISTANT -> acc.addAssistant(record);
                case MALFORMED -> LOG.debug("Ignoring record at line {}", record.lineNumber());
            }
        }

        return acc.finish(finalizeTrailingTurn);
    }

    private static final class Accumulator {
        private final String sessionId;
        private final String project;
        private final int turnCount;
        private final List<Turn> turns = new ArrayList<>();

        private TranscriptRecord currentUser;
        private List<JsonNode> assistants = new ArrayList<>();
        private List<JsonNode> parts = new ArrayList<>();
        private String currentMessageId;
        private List<JsonNode> toolResults = new ArrayList<>();

        private Accumulator(String sessionId, String project, int turnCount) {
            this.sessionId = sessionId;
            this.project = project;
            this.turnCount = turnCount;
        }

        void startTurn(TranscriptRecord user) {
            flushParts();
            emitIfComplete();
            currentUser = user;
            assistants = new ArrayList<>();
            parts = new ArrayList<>();
            currentMessageId = null;
            toolResults = new ArrayList<>();
        }

        void addAssistant(TranscriptRecord record) {
            if (!record.hasMessageId()) {
                flushParts();
                assistants.add(record.raw());
                return;
            }
            if (record.messageId().equals(currentMessageId)) {
                parts.add(record.raw());
                return;
            }
            flushParts();
            currentMessageId = record.messageId();
            parts.add(record.raw());
        }

        AssemblyResult finish(boolean finalizeTrailingTurn) {
            if (currentUser == null) {
                return new AssemblyResult(turns, Optional.empty());
            }
            boolean hasOutput = !assistants.isEmpty() || !parts.isEmpty();
            if (finalizeTrailingTurn && hasOutput) {
                flushParts();
                emitIfComplete();
                return new AssemblyResult(turns, Optional.empty());
            }
            return new AssemblyResult(turns, Optional.of(new PendingTurn(currentUser.lineNumber(), hasOutput)));
        }

        private void flushParts() {
            if (!parts.isEmpty()) {
                assistants.add(RecordContent.mergeParts(parts));
            }
            parts = new ArrayList<>();
            currentMessageId = null;
        }

        private void emitIfComplete() {
            if (currentUser == null || assistants.isEmpty()) {
                return;
            }
            int turnNumber = turnCount + turns.size() + 1;
            turns.add(new Turn(sessionId, project, turnNumber, currentUser.raw(), assistants, toolResults));
            LOG.debug("Assembled turn {} for session {}", turnNumber, sessionId);
        }
    }
}
