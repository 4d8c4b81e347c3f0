package io.tracebridge.core.transcript;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TranscriptReader {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptReader.class);

    private final TranscriptParser parser;

    public TranscriptReader(TranscriptParser parser) {
        this.parser = parser;
    }

    /**
     * Parses every complete line at or after {@code fromLine}. A trailing
     * segment without a newline is still being written and is left for the
     * next pass.
     */
    public TranscriptSlice read(Path transcript, long fromLine) throws IOException {
        String text = new String(Files.readAllBytes(transcript), StandardCharsets.UTF_8);
        List<String> lines = completeLines(text);
        if (fromLine >= lines.size()) {
            LOG.debug("No new lines in {} (checkpoint {}, total {})", transcript, fromLine, lines.size());
            return new TranscriptSlice(List.of(), lines.size());
        }

        List<TranscriptRecord> records = new ArrayList<>();
        for (int i = (int) Math.max(0, fromLine); i < lines.size(); i++) {
            TranscriptRecord record = parser.parse(lines.get(i), i);
            if (record.kind() != RecordKind.MALFORMED) {
                records.add(record);
            }
        }
        return new TranscriptSlice(records, lines.size());
    }

    static List<String> completeLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = text.indexOf('\n', start)) >= 0) {
            String line = text.substring(start, newline);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = newline + 1;
        }
        return lines;
    }
}
