package io.tracebridge.cli;

import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.pipeline.RunSummary;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(name = "drain", description = "Deliver queued turns to healthy backends")
public final class DrainCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(DrainCommand.class);

    private final CliContext context;

    public DrainCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TracebridgeConfig config = context.loadConfig();
            RunSummary summary = context.pipelineFactory().create(config).drainOnly();
            System.out.println("Drained " + summary.turnsDrained() + " queued turns to "
                + summary.healthyBackends() + " healthy backends");
        } catch (Exception e) {
            LOG.error("Drain failed: {}", e.getMessage(), e);
            System.err.println("Drain failed: " + e.getMessage());
        }
        return 0;
    }
}
