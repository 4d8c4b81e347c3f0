package io.tracebridge.core.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TranscriptParser {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptParser.class);

    private final ObjectMapper mapper;

    public TranscriptParser() {
        this(new ObjectMapper());
    }

    public TranscriptParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TranscriptRecord parse(String line, long lineNumber) {
        if (line == null || line.isBlank()) {
            return TranscriptRecord.malformed(lineNumber);
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (Exception e) {
            LOG.debug("Skipping unparseable line {}: {}", lineNumber, e.getMessage());
            return TranscriptRecord.malformed(lineNumber);
        }
        if (node == null || !node.isObject()) {
            LOG.debug("Skipping non-object line {}", lineNumber);
            return TranscriptRecord.malformed(lineNumber);
        }

        String role = RecordContent.roleOf(node);
        return switch (role) {
            case "user" -> new TranscriptRecord(
                RecordContent.isToolResultCarrier(node) ? RecordKind.TOOL_RESULT : RecordKind.USER,
                node,
                null,
                lineNumber
            );
            case "assistant" -> new TranscriptRecord(RecordKind.ASSISTANT, node, RecordContent.messageIdOf(node), lineNumber);
            default -> new TranscriptRecord(RecordKind.MALFORMED, node, null, lineNumber);
        };
    }
}
