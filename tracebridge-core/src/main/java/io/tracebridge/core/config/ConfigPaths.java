package io.tracebridge.core.config;

import io.tracebridge.core.config.model.TracebridgeConfig;
import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CHECKPOINT_FILE = "tracebridge_state.json";
    public static final String QUEUE_FILE = "pending_traces.jsonl";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".tracebridge", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path projectsDir(TracebridgeConfig config) {
        return resolve(config.paths().projectsDir());
    }

    public static Path stateDir(TracebridgeConfig config) {
        return resolve(config.paths().stateDir());
    }

    public static Path checkpointFile(TracebridgeConfig config) {
        return stateDir(config).resolve(CHECKPOINT_FILE);
    }

    public static Path queueFile(TracebridgeConfig config) {
        return stateDir(config).resolve(QUEUE_FILE);
    }
}
