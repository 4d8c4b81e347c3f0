package io.tracebridge.cli;

import io.tracebridge.core.checkpoint.FileCheckpointStore;
import io.tracebridge.core.config.ConfigPaths;
import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.queue.FileDeliveryQueue;
import java.nio.file.Files;
import java.time.Clock;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, tracked sessions and queue size")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TracebridgeConfig config = context.loadConfig();
            int trackedSessions = new FileCheckpointStore(ConfigPaths.checkpointFile(config)).load().size();
            int queuedTurns = new FileDeliveryQueue(ConfigPaths.queueFile(config), Clock.systemUTC()).loadAll().size();

            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Projects dir: " + ConfigPaths.projectsDir(config));
            System.out.println("State dir: " + ConfigPaths.stateDir(config));
            System.out.println("Langfuse enabled: " + config.backends().langfuse().enabled()
                + " (configured: " + config.backends().langfuse().configured() + ")");
            System.out.println("OTLP enabled: " + config.backends().otlp().enabled()
                + " (configured: " + config.backends().otlp().configured() + ")");
            System.out.println("Tracked sessions: " + trackedSessions);
            System.out.println("Queued turns: " + queuedTurns);
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
