package io.tracebridge.core.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record ToolResult(String toolUseId, JsonNode content) {

    public ToolResult {
        toolUseId = toolUseId == null ? "" : toolUseId;
        content = content == null || content.isMissingNode() ? NullNode.getInstance() : content;
    }
}
