package com.swarmprobe.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.persistence.LoopStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * CLI command: swarmprobe status
 * <p>
 * Prints the persisted loop state of the last run.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the persisted loop state")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--state-file"}, description = "State file (default: from configuration)")
    private Path stateFile;

    private final SwarmProbeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StatusCommand(SwarmProbeProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var path = stateFile != null ? stateFile : properties.getState().resolvePath();
        var state = new LoopStateStore(path, objectMapper, clock).read();
        if (state.isEmpty()) {
            ConsoleOutput.error("No loop state at " + path);
            return 1;
        }
        ConsoleOutput.loopState(state.get());
        return 0;
    }
}
