package io.tracebridge.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, Path stateDir, boolean createdConfig, boolean overwrittenConfig) {
}
