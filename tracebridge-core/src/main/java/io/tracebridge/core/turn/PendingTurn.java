package io.tracebridge.core.turn;

/**
 * A turn that was opened but not emitted in this pass.
 *
 * @param startLine          line of the user record that opened it; the next pass resumes here
 * @param hasAssistantOutput whether any assistant record was already seen
 */
public record PendingTurn(long startLine, boolean hasAssistantOutput) {
}
