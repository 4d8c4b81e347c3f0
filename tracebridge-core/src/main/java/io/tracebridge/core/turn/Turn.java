package io.tracebridge.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Objects;

/**
 * One completed user-to-assistant exchange, the unit of delivery.
 *
 * @param sessionId         transcript session identifier
 * @param project           project tag derived from the transcript location
 * @param turnNumber        1-based, monotonic per session across invocations
 * @param userMessage       raw user record that opened the turn
 * @param assistantMessages assistant records, multi-part responses already merged
 * @param toolResults       tool_result carrier records seen before the next user record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Turn(
    String sessionId,
    String project,
    int turnNumber,
    JsonNode userMessage,
    List<JsonNode> assistantMessages,
    List<JsonNode> toolResults
) {
    public Turn {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        project = project == null ? "" : project;
        userMessage = userMessage == null ? MissingNode.getInstance() : userMessage;
        assistantMessages = assistantMessages == null ? List.of() : List.copyOf(assistantMessages);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }
}
