package io.tracebridge.app;

import io.tracebridge.cli.CliContext;
import io.tracebridge.cli.TracebridgeCliCommand;
import io.tracebridge.core.config.ConfigPaths;
import io.tracebridge.core.config.ConfigService;
import io.tracebridge.core.config.model.TracebridgeConfig;
import java.nio.file.Path;
import java.util.Map;
import picocli.CommandLine;

public final class TracebridgeApplication {

    private TracebridgeApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Map<String, String> environment = System.getenv();
        TracebridgeConfig config = loadConfig(configService, configPath, environment);

        LogSetup.prepare(ConfigPaths.stateDir(config));
        LogSetup.applyDebug(config.pipeline().debug());

        CliContext context = new CliContext(configService, configPath, environment);

        CommandLine commandLine = TracebridgeCliCommand.commandLine(context);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static TracebridgeConfig loadConfig(ConfigService configService, Path configPath, Map<String, String> environment) {
        try {
            return configService.load(configPath, environment);
        } catch (Exception ignored) {
            // the commands log the unreadable file once logging is up
            return configService.applyEnvironment(TracebridgeConfig.defaults(), environment);
        }
    }
}
