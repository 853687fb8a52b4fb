package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.engine.ReconciliationEngine;
import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.health.HealthCheckService;
import com.vulnconsole.core.health.HealthStatus;
import com.vulnconsole.core.model.CatalogStats;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.operations.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private static final String NGINX = "nginx/CVE-2021-23017";
    private static final String PHP = "php/CVE-2019-11043";

    private record CliResult(int exitCode, String output) {}

    private ReconciliationEngine engine;
    private EventBus eventBus;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        engine = mock(ReconciliationEngine.class);
        eventBus = new EventBus();
        healthCheckService = mock(HealthCheckService.class);
    }

    private static EnvironmentDescriptor env(String id, EnvironmentStatus status, int port) {
        String[] parts = id.split("/");
        return new EnvironmentDescriptor(id, parts[0], parts[1], Map.of("web", port), List.of("web"),
                List.of("img"), false, List.of(), true, status, "1-1", false, false, false, List.of(),
                Instant.parse("2026-03-01T10:00:00Z"), null);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ListCommand.class) return (K) new ListCommand(engine);
                if (cls == StatsCommand.class) return (K) new StatsCommand(engine);
                if (cls == StartCommand.class) return (K) new StartCommand(engine);
                if (cls == StopCommand.class) return (K) new StopCommand(engine);
                if (cls == PullCommand.class) return (K) new PullCommand(engine, eventBus);
                if (cls == RefreshCommand.class) return (K) new RefreshCommand(engine);
                if (cls == HealthCommand.class) return (K) new HealthCommand(healthCheckService);
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
            int exitCode = new CommandLine(new ConsoleCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String command : List.of("list", "stats", "start", "stop", "pull", "refresh", "health", "serve")) {
                assertTrue(result.output().contains(command), "Help should list '" + command + "'");
            }
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("vulnconsole 0.1.0"));
        }

        @Test
        @DisplayName("start without an id is a usage error")
        void startNeedsId() {
            CliResult result = execute("start");

            assertNotEquals(0, result.exitCode());
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("list")
    class ListTests {

        @Test
        @DisplayName("filters by category and prints a summary")
        void filtersByCategory() {
            when(engine.getEnvironments(false)).thenReturn(List.of(
                    env(NGINX, EnvironmentStatus.RUNNING, 8080), env(PHP, EnvironmentStatus.STOPPED, 8081)));

            CliResult result = execute("list", "--category", "php");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains(PHP));
            assertFalse(result.output().contains(NGINX));
            assertTrue(result.output().contains("1 of 2 environments"));
        }

        @Test
        @DisplayName("--running shows running environments with their URL")
        void runningOnly() {
            when(engine.getEnvironments(false)).thenReturn(List.of(
                    env(NGINX, EnvironmentStatus.RUNNING, 8080), env(PHP, EnvironmentStatus.STOPPED, 8081)));

            CliResult result = execute("list", "--running");

            assertTrue(result.output().contains(NGINX));
            assertTrue(result.output().contains("http://localhost:8080"));
            assertFalse(result.output().contains(PHP));
        }

        @Test
        @DisplayName("--refresh forces a rescan")
        void refresh() {
            when(engine.getEnvironments(true)).thenReturn(List.of());

            execute("list", "--refresh");

            verify(engine).getEnvironments(true);
        }
    }

    @Nested
    @DisplayName("operations")
    class OperationTests {

        @Test
        @DisplayName("start prints the URL of the started environment")
        void startSuccess() {
            when(engine.start(NGINX)).thenReturn(OperationResult.success(NGINX, "start")
                    .withEnvironment(env(NGINX, EnvironmentStatus.RUNNING, 8080)));

            CliResult result = execute("start", NGINX);

            assertTrue(result.output().contains("start " + NGINX + " succeeded"));
            assertTrue(result.output().contains("http://localhost:8080"));
        }

        @Test
        @DisplayName("start lists the containers holding the port")
        void startConflict() {
            when(engine.start(PHP)).thenReturn(OperationResult.portConflict(PHP,
                    "Host port already in use by nginx-web-1", List.of("nginx-web-1")));

            CliResult result = execute("start", PHP);

            assertTrue(result.output().contains("port conflict"));
            assertTrue(result.output().contains("- nginx-web-1"));
        }

        @Test
        @DisplayName("stop reports the result")
        void stop() {
            when(engine.stop(NGINX)).thenReturn(OperationResult.success(NGINX, "stop"));

            CliResult result = execute("stop", NGINX);

            assertTrue(result.output().contains("stop " + NGINX + " succeeded"));
        }

        @Test
        @DisplayName("pull prints progress until the operation ends")
        void pull() {
            when(engine.pullImages(NGINX)).thenAnswer(inv -> {
                eventBus.publish(ConsoleEvent.of(ConsoleEvent.PULL_LOG, NGINX, Map.of("line", "Pulling nginx:1.20")));
                eventBus.publish(ConsoleEvent.of(ConsoleEvent.OPERATION_COMPLETED, NGINX, Map.of("operation", "pull")));
                return OperationResult.accepted(NGINX, "pull");
            });

            CliResult result = execute("pull", NGINX);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Pulling nginx:1.20"));
            assertTrue(result.output().contains("are present"));
            assertEquals(0, eventBus.subscribedEnvironmentCount());
        }

        @Test
        @DisplayName("pull reports a busy environment without waiting")
        void pullBusy() {
            when(engine.pullImages(NGINX)).thenReturn(OperationResult.busy(NGINX, "pull"));

            CliResult result = execute("pull", NGINX);

            assertTrue(result.output().contains("Another operation is already running"));
            assertEquals(0, eventBus.subscribedEnvironmentCount());
        }
    }

    @Test
    @DisplayName("stats prints the counters per category")
    void stats() {
        when(engine.stats()).thenReturn(new CatalogStats(2, 1, 1, 0, 1, 2, Map.of("nginx", 1, "php", 1)));

        CliResult result = execute("stats");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("nginx"));
    }

    @Test
    @DisplayName("health marks down components")
    void health() {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("catalog", HealthStatus.Status.UP, "Catalog root readable", Map.of("path", "/srv/vulhub")),
                new HealthStatus("runtime", HealthStatus.Status.DOWN, "Runtime error: daemon not running", Map.of())));

        CliResult result = execute("health");

        assertTrue(result.output().contains("/srv/vulhub"));
        assertTrue(result.output().contains("daemon not running"));
        assertTrue(result.output().contains("one or more components down"));
    }
}
