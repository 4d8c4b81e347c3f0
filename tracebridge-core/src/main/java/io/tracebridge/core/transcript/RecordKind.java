package io.tracebridge.core.transcript;

public enum RecordKind {
    USER,
    ASSISTANT,
    /** A user-role record carrying tool_result blocks; never starts a turn. */
    TOOL_RESULT,
    /** Unparseable line or unrecognised shape; always skipped. */
    MALFORMED
}
