package io.tracebridge.core.transcript;

import java.util.List;

/**
 * Records read past a checkpoint.
 *
 * @param records       parsed records, in file order
 * @param completeLines number of newline-terminated lines in the file
 */
public record TranscriptSlice(List<TranscriptRecord> records, long completeLines) {

    public TranscriptSlice {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
