package io.tracebridge.cli;

import io.tracebridge.core.config.ConfigService;
import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.pipeline.TracePipeline;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    PipelineFactory pipelineFactory
) {
    private static final Logger LOG = LoggerFactory.getLogger(CliContext.class);

    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath, Map<String, String> environment) {
        this(configService, configPath, environment, config -> TracePipeline.fromConfig(config, Clock.systemUTC()));
    }

    /**
     * Config file merged over defaults, with environment variables applied last.
     * An unreadable file falls back to defaults plus environment.
     */
    public TracebridgeConfig loadConfig() {
        try {
            return configService.load(configPath, environment);
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
            return configService.applyEnvironment(TracebridgeConfig.defaults(), environment);
        }
    }
}
