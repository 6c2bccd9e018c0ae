package com.swarmprobe.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for SwarmProbe.
 * Routes to subcommands: run, status, health.
 */
@Command(
        name = "swarmprobe",
        mixinStandardHelpOptions = true,
        version = "SwarmProbe 0.1.0",
        description = "Continuous multi-agent fuzzing and anomaly detection against a world server",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwarmProbeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
