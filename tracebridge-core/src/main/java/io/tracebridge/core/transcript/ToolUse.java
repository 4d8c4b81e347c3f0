package io.tracebridge.core.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record ToolUse(String id, String name, JsonNode input) {

    public ToolUse {
        id = id == null ? "" : id;
        name = name == null || name.isBlank() ? "unknown" : name;
        input = input == null || input.isMissingNode() ? NullNode.getInstance() : input;
    }
}
