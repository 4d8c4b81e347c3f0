package io.tracebridge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tracebridge.core.config.model.TracebridgeConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;
    private final EnvironmentOverrides environmentOverrides;

    public ConfigService() {
        this(new EnvironmentOverrides());
    }

    public ConfigService(EnvironmentOverrides environmentOverrides) {
        this.environmentOverrides = Objects.requireNonNull(environmentOverrides, "environmentOverrides must not be null");
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public TracebridgeConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return TracebridgeConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(TracebridgeConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, TracebridgeConfig.class);
    }

    /**
     * Loads the config file and applies environment variables on top of it.
     * Environment variables win over file values.
     */
    public TracebridgeConfig load(Path configPath, Map<String, String> environment) throws IOException {
        return environmentOverrides.apply(load(configPath), environment);
    }

    public TracebridgeConfig applyEnvironment(TracebridgeConfig config, Map<String, String> environment) {
        return environmentOverrides.apply(config, environment);
    }

    public void save(Path configPath, TracebridgeConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        TracebridgeConfig config;
        if (created || overwrite) {
            config = TracebridgeConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path stateDir = ConfigPaths.stateDir(config);
        Files.createDirectories(stateDir);
        return new InitResult(configPath, stateDir, created, overwritten);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
