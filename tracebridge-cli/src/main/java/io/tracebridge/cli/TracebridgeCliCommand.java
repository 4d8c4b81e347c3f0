package io.tracebridge.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root command. Invoked without a subcommand it performs a {@code run} pass,
 * so a hook can call the binary with no arguments.
 */
@Command(
    name = "tracebridge",
    mixinStandardHelpOptions = true,
    description = {
        "Ship assistant session transcripts to Langfuse and OTLP as traces.",
        "Without a command, processes changed transcripts once (same as 'run')."
    }
)
public final class TracebridgeCliCommand implements Callable<Integer> {
    private final CliContext context;

    public TracebridgeCliCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        return new RunCommand(context).call();
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new TracebridgeCliCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("drain", new DrainCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        return commandLine;
    }
}
