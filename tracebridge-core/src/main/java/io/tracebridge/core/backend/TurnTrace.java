package io.tracebridge.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

/**
 * Backend-neutral span tree for one turn: a root span, one generation span
 * and one span per tool call.
 */
public record TurnTrace(
    String name,
    String sessionId,
    int turnNumber,
    String project,
    List<String> tags,
    String userText,
    String assistantText,
    String model,
    Instant startedAt,
    Instant endedAt,
    List<ToolSpan> tools
) {
    public static final String GENERATION_NAME = "Claude Response";

    public TurnTrace {
        tags = tags == null ? List.of() : List.copyOf(tags);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    /**
     * @param output matched tool_result content, {@code null} when no result carried the call id
     */
    public record ToolSpan(String id, String name, JsonNode input, JsonNode output) {

        public String spanName() {
            return "Tool: " + name;
        }

        public boolean hasOutput() {
            return output != null;
        }
    }
}
