package com.swarmprobe.dispatch.cli;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: swarmprobe health
 * <p>
 * Probes the target world server and the issue tracker.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check target and tracker health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--url"}, description = "Target base URL (default: from configuration)")
    private String url;

    private final HealthCheckService healthCheckService;
    private final SwarmProbeProperties properties;

    public HealthCommand(HealthCheckService healthCheckService, SwarmProbeProperties properties) {
        this.healthCheckService = healthCheckService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (url != null) {
            properties.getTarget().setBaseUrl(url);
        }

        var checks = healthCheckService.checkAll();
        boolean targetUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail() + " " + check.metadata().values();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    if ("target".equals(check.component())) {
                        targetUp = false;
                    }
                }
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (targetUp) {
            ConsoleOutput.success("Overall: target reachable");
            return 0;
        }
        ConsoleOutput.error("Overall: target unreachable");
        return 1;
    }
}
