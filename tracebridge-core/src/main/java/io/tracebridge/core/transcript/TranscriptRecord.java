package io.tracebridge.core.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

/**
 * One line of a session transcript, classified by {@link RecordKind}.
 *
 * @param kind       classification used by the turn assembler
 * @param raw        the parsed JSON object, or a missing node for malformed lines
 * @param messageId  {@code message.id} of assistant records, {@code null} when absent
 * @param lineNumber zero-based line index inside the transcript file
 */
public record TranscriptRecord(RecordKind kind, JsonNode raw, String messageId, long lineNumber) {

    public TranscriptRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        raw = raw == null ? MissingNode.getInstance() : raw;
        messageId = messageId == null || messageId.isBlank() ? null : messageId;
    }

    public static TranscriptRecord malformed(long lineNumber) {
        return new TranscriptRecord(RecordKind.MALFORMED, MissingNode.getInstance(), null, lineNumber);
    }

    public boolean hasMessageId() {
        return messageId != null;
    }
}
