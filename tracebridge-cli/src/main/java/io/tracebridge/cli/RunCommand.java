package io.tracebridge.cli;

import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.pipeline.RunSummary;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Hook entry point. Always exits 0 so the calling tool is never blocked.
 */
@Command(name = "run", description = "Process changed transcripts and deliver new turns")
public final class RunCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    private final CliContext context;

    @Option(names = "--print-summary", description = "Print the pass summary to stdout")
    boolean printSummary;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TracebridgeConfig config = context.loadConfig();
            if (!config.backends().anyEnabled()) {
                LOG.debug("Tracing disabled: no backend enabled");
                return 0;
            }
            RunSummary summary = context.pipelineFactory().create(config).run();
            if (printSummary) {
                System.out.println(summary.describe());
            }
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
        }
        return 0;
    }
}
