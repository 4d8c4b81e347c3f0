package io.tracebridge.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import io.tracebridge.core.middleware.SecretRedactor;
import io.tracebridge.core.transcript.RecordContent;
import io.tracebridge.core.transcript.ToolResult;
import io.tracebridge.core.transcript.ToolUse;
import io.tracebridge.core.turn.Turn;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class TurnTraceBuilder {
    public static final String SOURCE_TAG = "claude-code";
    private static final String DEFAULT_MODEL = "claude";

    private final SecretRedactor redactor;
    private final Clock clock;

    public TurnTraceBuilder(SecretRedactor redactor, Clock clock) {
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TurnTrace build(Turn turn) {
        List<JsonNode> assistants = turn.assistantMessages();
        String userText = redactor.redact(RecordContent.textOf(turn.userMessage()));
        String assistantText = assistants.isEmpty()
            ? ""
            : redactor.redact(RecordContent.textOf(assistants.get(assistants.size() - 1)));
        String model = assistants.isEmpty()
            ? DEFAULT_MODEL
            : RecordContent.modelOf(assistants.get(0), DEFAULT_MODEL);

        List<TurnTrace.ToolSpan> tools = new ArrayList<>();
        for (JsonNode assistant : assistants) {
            for (ToolUse use : RecordContent.toolUseBlocks(assistant)) {
                JsonNode output = findResult(turn.toolResults(), use.id());
                tools.add(new TurnTrace.ToolSpan(
                    use.id(),
                    use.name(),
                    redactor.redact(use.input()),
                    output == null ? null : redactor.redact(output)
                ));
            }
        }

        List<String> tags = new ArrayList<>();
        tags.add(SOURCE_TAG);
        if (!turn.project().isBlank()) {
            tags.add(turn.project());
        }

        Instant now = clock.instant();
        Instant startedAt = RecordContent.timestampOf(turn.userMessage()).orElse(now);
        Instant endedAt = assistants.isEmpty()
            ? startedAt
            : RecordContent.timestampOf(assistants.get(assistants.size() - 1)).orElse(now);
        if (endedAt.isBefore(startedAt)) {
            endedAt = startedAt;
        }

        return new TurnTrace(
            "Turn " + turn.turnNumber(),
            turn.sessionId(),
            turn.turnNumber(),
            turn.project(),
            tags,
            userText,
            assistantText,
            model,
            startedAt,
            endedAt,
            tools
        );
    }

    private JsonNode findResult(List<JsonNode> toolResults, String toolUseId) {
        for (JsonNode carrier : toolResults) {
            for (ToolResult result : RecordContent.toolResultBlocks(carrier)) {
                if (result.toolUseId().equals(toolUseId)) {
                    return result.content();
                }
            }
        }
        return null;
    }
}
