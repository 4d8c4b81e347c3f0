package io.tracebridge.core.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptReaderTest {

    @TempDir
    Path tempDir;

    private final TranscriptReader reader = new TranscriptReader(new TranscriptParser());

    @Test
    void shouldIgnoreUnterminatedTrailingLine() throws Exception {
        Path transcript = tempDir.resolve("s.jsonl");
        Files.writeString(transcript, """
            {"type":"user","message":{"content":"a"}}
            {"type":"assistant","message":{"id":"m1","content":"b"}}
            {"type":"user","message":{"con""");

        TranscriptSlice slice = reader.read(transcript, 0);

        assertThat(slice.completeLines()).isEqualTo(2);
        assertThat(slice.records()).extracting(TranscriptRecord::kind)
            .containsExactly(RecordKind.USER, RecordKind.ASSISTANT);
    }

    @Test
    void shouldSkipMalformedLinesButCountThem() throws Exception {
        Path transcript = tempDir.resolve("s.jsonl");
        Files.writeString(transcript, "{\"type\":\"user\",\"message\":{\"content\":\"a\"}}\r\n"
            + "not json\n"
            + "{\"type\":\"assistant\",\"message\":{\"content\":\"b\"}}\n");

        TranscriptSlice slice = reader.read(transcript, 0);

        assertThat(slice.completeLines()).isEqualTo(3);
        assertThat(slice.records()).extracting(TranscriptRecord::lineNumber).containsExactly(0L, 2L);
    }

    @Test
    void shouldStartAtCheckpointLine() throws Exception {
        Path transcript = tempDir.resolve("s.jsonl");
        Files.writeString(transcript, """
            {"type":"user","message":{"content":"a"}}
            {"type":"assistant","message":{"content":"b"}}
            {"type":"user","message":{"content":"c"}}
            """);

        TranscriptSlice slice = reader.read(transcript, 2);
        TranscriptSlice empty = reader.read(transcript, 3);

        assertThat(slice.records()).singleElement().satisfies(record -> {
            assertThat(record.lineNumber()).isEqualTo(2);
            assertThat(RecordContent.textOf(record.raw())).isEqualTo("c");
        });
        assertThat(empty.records()).isEmpty();
        assertThat(empty.completeLines()).isEqualTo(3);
    }

    @Test
    void shouldSplitOnlyNewlineTerminatedLines() {
        assertThat(TranscriptReader.completeLines("")).isEmpty();
        assertThat(TranscriptReader.completeLines("partial")).isEmpty();
        assertThat(TranscriptReader.completeLines("a\nb\r\nc")).containsExactly("a", "b");
    }
}
