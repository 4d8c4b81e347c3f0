package io.tracebridge.cli;

import io.tracebridge.core.config.ConfigPaths;
import io.tracebridge.core.config.InitResult;
import io.tracebridge.core.config.model.LangfuseConfig;
import io.tracebridge.core.config.model.OtlpConfig;
import io.tracebridge.core.config.model.TracebridgeConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Writes the config file, creates the state directory and reports which
 * backends the resulting configuration (file plus environment) will use.
 */
@Command(name = "init", description = "Write the config file and state directory, then report backend readiness")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Reset the config file to defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        InitResult result;
        try {
            result = context.configService().init(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }

        String action = result.createdConfig() ? "created"
            : result.overwrittenConfig() ? "reset to defaults"
            : "merged with new defaults";
        System.out.println("Config " + action + ": " + result.configPath());
        System.out.println("State directory: " + result.stateDir());

        TracebridgeConfig config = context.loadConfig();
        Path projectsDir = ConfigPaths.projectsDir(config);
        System.out.println("Transcripts: " + projectsDir + (Files.isDirectory(projectsDir) ? "" : " (not found yet)"));
        System.out.println("Langfuse: " + readiness(config.backends().langfuse()));
        System.out.println("OTLP: " + readiness(config.backends().otlp()));
        if (!config.backends().anyEnabled()) {
            System.out.println("Tracing is off. Set TRACE_TO_LANGFUSE=true or TRACE_TO_OTLP=true to enable it.");
        }
        return 0;
    }

    private static String readiness(LangfuseConfig langfuse) {
        if (!langfuse.enabled()) {
            return "disabled";
        }
        return langfuse.configured() ? "ready (" + langfuse.host() + ")" : "enabled but LANGFUSE_PUBLIC_KEY/LANGFUSE_SECRET_KEY missing";
    }

    private static String readiness(OtlpConfig otlp) {
        if (!otlp.enabled()) {
            return "disabled";
        }
        return otlp.configured() ? "ready (" + otlp.endpoint() + ")" : "enabled but OTEL_EXPORTER_OTLP_ENDPOINT missing";
    }
}
