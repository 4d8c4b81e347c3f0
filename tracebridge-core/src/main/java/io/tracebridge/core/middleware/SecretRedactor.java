package io.tracebridge.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks obvious credentials before transcript text leaves the machine.
 * Only well-known key, token and password shapes are matched.
 */
public final class SecretRedactor {
    private static final List<Rule> RULES = List.of(
        new Rule(Pattern.compile("sk-lf-[a-zA-Z0-9-]{20,}", Pattern.CASE_INSENSITIVE), "sk-lf-[REDACTED]"),
        new Rule(Pattern.compile("sk-[a-zA-Z0-9]{20,}", Pattern.CASE_INSENSITIVE), "sk-[REDACTED]"),
        new Rule(Pattern.compile("Bearer [a-zA-Z0-9._-]{20,}", Pattern.CASE_INSENSITIVE), "Bearer [REDACTED]"),
        new Rule(
            Pattern.compile("token[\"']?\\s*[:=]\\s*[\"']?[a-zA-Z0-9._-]{20,}", Pattern.CASE_INSENSITIVE),
            "token: [REDACTED]"
        ),
        new Rule(
            Pattern.compile("password[\"']?\\s*[:=]\\s*[\"']?[^\\s\"']{8,}", Pattern.CASE_INSENSITIVE),
            "password: [REDACTED]"
        ),
        new Rule(
            Pattern.compile("api[_-]?key[\"']?\\s*[:=]\\s*[\"']?[a-zA-Z0-9._-]{16,}", Pattern.CASE_INSENSITIVE),
            "api_key: [REDACTED]"
        )
    );

    private final boolean enabled;

    public SecretRedactor() {
        this(true);
    }

    public SecretRedactor(boolean enabled) {
        this.enabled = enabled;
    }

    public String redact(String input) {
        if (input == null) {
            return "";
        }
        if (!enabled || input.isBlank()) {
            return input;
        }
        String out = input;
        for (Rule rule : RULES) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        return out;
    }

    /**
     * Redacts every string inside a JSON value, returning a copy.
     */
    public JsonNode redact(JsonNode node) {
        if (!enabled || node == null) {
            return node;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(redact(node.asText()));
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            node.fields().forEachRemaining(entry -> copy.set(entry.getKey(), redact(entry.getValue())));
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            node.forEach(item -> copy.add(redact(item)));
            return copy;
        }
        return node;
    }

    private record Rule(Pattern pattern, String replacement) {
    }
}
