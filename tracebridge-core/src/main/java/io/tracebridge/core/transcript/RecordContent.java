package io.tracebridge.core.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only accessors over raw transcript JSON.
 * <p>
 * Every method is total: unexpected shapes yield an empty string, an empty
 * list or a missing node, never an exception.
 */
public final class RecordContent {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RecordContent() {
    }

    /**
     * Returns {@code message.content} for nested records, {@code content} otherwise.
     */
    public static JsonNode contentOf(JsonNode record) {
        if (record == null || !record.isObject()) {
            return MissingNode.getInstance();
        }
        if (record.has("message")) {
            return record.path("message").path("content");
        }
        return record.path("content");
    }

    public static String roleOf(JsonNode record) {
        if (record == null || !record.isObject()) {
            return "";
        }
        String type = record.path("type").asText("");
        if (!type.isBlank()) {
            return type;
        }
        return record.path("message").path("role").asText("");
    }

    public static String messageIdOf(JsonNode record) {
        if (record == null || !record.isObject()) {
            return null;
        }
        JsonNode id = record.path("message").path("id");
        return id.isTextual() && !id.asText().isBlank() ? id.asText() : null;
    }

    public static String modelOf(JsonNode record, String fallback) {
        if (record == null || !record.isObject()) {
            return fallback;
        }
        JsonNode model = record.path("message").path("model");
        return model.isTextual() && !model.asText().isBlank() ? model.asText() : fallback;
    }

    public static Optional<Instant> timestampOf(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        JsonNode timestamp = record.path("timestamp");
        if (!timestamp.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(timestamp.asText()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isToolResultCarrier(JsonNode record) {
        JsonNode content = contentOf(record);
        if (!content.isArray()) {
            return false;
        }
        for (JsonNode item : content) {
            if (item.isObject() && "tool_result".equals(item.path("type").asText())) {
                return true;
            }
        }
        return false;
    }

    public static List<ToolUse> toolUseBlocks(JsonNode record) {
        JsonNode content = contentOf(record);
        if (!content.isArray()) {
            return List.of();
        }
        List<ToolUse> uses = new ArrayList<>();
        for (JsonNode item : content) {
            if (item.isObject() && "tool_use".equals(item.path("type").asText())) {
                uses.add(new ToolUse(
                    item.path("id").asText(""),
                    item.path("name").asText("unknown"),
                    item.has("input") ? item.get("input") : NODES.objectNode()
                ));
            }
        }
        return uses;
    }

    public static List<ToolResult> toolResultBlocks(JsonNode record) {
        JsonNode content = contentOf(record);
        if (!content.isArray()) {
            return List.of();
        }
        List<ToolResult> results = new ArrayList<>();
        for (JsonNode item : content) {
            if (item.isObject() && item.has("tool_use_id")) {
                results.add(new ToolResult(item.path("tool_use_id").asText(""), item.path("content")));
            }
        }
        return results;
    }

    /**
     * Concatenates text blocks (and bare strings) with newlines; a string
     * content is returned as is.
     */
    public static String textOf(JsonNode record) {
        JsonNode content = contentOf(record);
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode item : content) {
            if (item.isObject() && "text".equals(item.path("type").asText())) {
                parts.add(item.path("text").asText(""));
            } else if (item.isTextual()) {
                parts.add(item.asText());
            }
        }
        return String.join("\n", parts);
    }

    /**
     * Merges the parts of one logical assistant message into a single record.
     * Blocks keep their order across parts; string contents become text
     * blocks. The result takes the shape (nested {@code message} or direct
     * {@code content}) of the first part.
     */
    public static JsonNode mergeParts(List<JsonNode> parts) {
        if (parts == null || parts.isEmpty()) {
            return NODES.objectNode();
        }
        ArrayNode merged = NODES.arrayNode();
        for (JsonNode part : parts) {
            JsonNode content = contentOf(part);
            if (content.isArray()) {
                for (JsonNode block : content) {
                    merged.add(block.deepCopy());
                }
            } else if (content.isTextual() && !content.asText().isEmpty()) {
                ObjectNode text = NODES.objectNode();
                text.put("type", "text");
                text.put("text", content.asText());
                merged.add(text);
            }
        }

        JsonNode first = parts.get(0);
        if (!first.isObject()) {
            ObjectNode result = NODES.objectNode();
            result.set("content", merged);
            return result;
        }
        ObjectNode result = first.deepCopy();
        if (result.path("message").isObject()) {
            ((ObjectNode) result.get("message")).set("content", merged);
        } else {
            result.set("content", merged);
        }
        return result;
    }
}
