package io.tracebridge.core.pipeline;

import java.nio.file.Path;
import java.time.Instant;

public record SessionSource(String sessionId, String project, Path transcript, Instant modifiedAt) {
}
