package com.swarmprobe.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.engine.LoopFactory;
import com.swarmprobe.core.engine.LoopOrchestrator;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.health.HealthCheckService;
import com.swarmprobe.core.health.HealthStatus;
import com.swarmprobe.core.model.LoopState;
import com.swarmprobe.core.model.StressLevel;
import com.swarmprobe.core.model.StressParameters;
import com.swarmprobe.core.persistence.LoopStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the SwarmProbe CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    private SwarmProbeProperties properties;
    private LoopFactory loopFactory;
    private LoopOrchestrator orchestrator;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        properties = new SwarmProbeProperties();
        properties.getState().setPath(tempDir.resolve("missing.json").toString());
        orchestrator = mock(LoopOrchestrator.class);
        when(orchestrator.run()).thenReturn(true);
        when(orchestrator.state()).thenReturn(LoopState.initial(NOW,
                new StressParameters(StressLevel.MEDIUM, 10, 2000, false)));
        loopFactory = mock(LoopFactory.class);
        when(loopFactory.create()).thenReturn(orchestrator);
        healthCheckService = mock(HealthCheckService.class);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(properties, loopFactory, new EventBus());
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(properties, mapper, CLOCK);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService, properties);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SwarmProbeCommand(), factory())
                    .setCaseInsensitiveEnumValuesAllowed(true);
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("status"));
            assertTrue(result.output().contains("health"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SwarmProbe 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows run options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            for (String option : List.of("--agents", "--stress", "--chaos", "--dry-run", "--room", "--url", "--seed")) {
                assertTrue(result.output().contains(option), "run help should show " + option);
            }
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("options override configuration before the loop is built")
        void optionsOverrideProperties() {
            CliResult result = execute("run", "--agents", "4", "--stress", "high", "--chaos", "--dry-run",
                    "--room", "lobby", "--url", "http://world:9000", "--delay", "750",
                    "--check-interval", "3000", "--seed", "42");

            assertEquals(0, result.exitCode(), result.output());
            var swarm = properties.getSwarm();
            assertEquals(4, swarm.getMemberCount());
            assertEquals("HIGH", swarm.getStressLevel());
            assertTrue(swarm.isChaosEnabled());
            assertTrue(properties.getTracker().isDryRun());
            assertEquals("lobby", properties.getRoomId());
            assertEquals("http://world:9000", properties.getBaseUrl());
            assertEquals(750, swarm.getCycleDelayMs());
            assertEquals(3000, swarm.getIssueCheckIntervalMs());
            assertEquals(42L, swarm.getSeed());
            verify(loopFactory).create();
            verify(orchestrator).run();
        }

        @Test
        @DisplayName("without options the configuration is left alone")
        void noOptions() {
            var defaults = new SwarmProbeProperties();

            CliResult result = execute("run");

            assertEquals(0, result.exitCode());
            assertEquals(defaults.getSwarm().getMemberCount(), properties.getSwarm().getMemberCount());
            assertEquals(defaults.getBaseUrl(), properties.getBaseUrl());
            assertFalse(properties.getTracker().isDryRun());
        }

        @Test
        @DisplayName("unreachable target exits 1")
        void unreachableTarget() {
            when(orchestrator.run()).thenReturn(false);

            CliResult result = execute("run");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Target not reachable"));
        }

        @Test
        @DisplayName("unknown stress level is a usage error")
        void badStressLevel() {
            CliResult result = execute("run", "--stress", "extreme");
            assertEquals(2, result.exitCode());
            verifyNoInteractions(loopFactory);
        }
    }

    // =====================================================================
    //  status
    // =====================================================================

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("prints the persisted loop state")
        void printsState() {
            var file = tempDir.resolve("state.json");
            var state = LoopState.initial(NOW, new StressParameters(StressLevel.LOW, 15, 4000, true))
                    .nextCycle().issueCreated("101")
                    .withMembers(List.of("agent-1", "agent-2"));
            new LoopStateStore(file, mapper, CLOCK).save(state);

            CliResult result = execute("status", "--state-file", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SESSION resident_" + NOW.toEpochMilli()));
            assertTrue(result.output().contains("Issues created: 1 (last: 101)"));
            assertTrue(result.output().contains("agent-2"));
        }

        @Test
        @DisplayName("missing state exits 1")
        void missingState() {
            CliResult result = execute("status");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No loop state"));
        }
    }

    // =====================================================================
    //  health
    // =====================================================================

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("target up with degraded tracker exits 0")
        void targetUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("target", HealthStatus.Status.UP, "World server reachable", Map.of()),
                    new HealthStatus("tracker", HealthStatus.Status.DEGRADED, "Dry-run mode", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Overall: target reachable"));
        }

        @Test
        @DisplayName("target down exits 1 and --url is applied first")
        void targetDown() {
            when(healthCheckService.checkAll()).thenAnswer(inv -> List.of(
                    new HealthStatus("target", HealthStatus.Status.DOWN, "World server unreachable",
                            Map.of("url", properties.getBaseUrl())),
                    new HealthStatus("tracker", HealthStatus.Status.UP, "Tracker reachable", Map.of())));

            CliResult result = execute("health", "--url", "http://nowhere:1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("http://nowhere:1"));
            assertTrue(result.output().contains("Overall: target unreachable"));
        }
    }
}
