package com.vulnconsole.core.engine;

import com.vulnconsole.core.cache.EnvironmentCacheStore;
import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.metrics.ConsoleMetrics;
import com.vulnconsole.core.model.CatalogStats;
import com.vulnconsole.core.model.ContainerState;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentDetail;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.model.ExploitFile;
import com.vulnconsole.core.model.MissingImages;
import com.vulnconsole.core.model.ReadinessResult;
import com.vulnconsole.core.operations.OperationCoordinator;
import com.vulnconsole.core.operations.OperationResult;
import com.vulnconsole.core.scanner.CatalogScanner;
import com.vulnconsole.runtime.RuntimeOutcome;
import com.vulnconsole.runtime.RuntimeProbe;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import com.github.dockerjava.api.exception.InternalServerErrorException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReconciliationEngineTest {

    private static final String NGINX = "nginx/CVE-2021-23017";
    private static final String PHP = "php/CVE-2019-11043";

    @TempDir
    Path tmp;

    private Path catalog;
    private RuntimeProbe probe;
    private EnvironmentCacheStore store;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws IOException {
        catalog = tmp.resolve("vulhub");
        environment(NGINX, "services:\n  web:\n    image: nginx:1.20\n    ports:\n      - \"8080:80\"\n");
        environment(PHP, "services:\n  php:\n    image: vulhub/php:7.2\n    ports:\n      - \"8081:80\"\n");

        probe = mock(RuntimeProbe.class);
        when(probe.imagesPresent(any())).thenAnswer(inv -> allPresent(inv.getArgument(0)));
        when(probe.containerStates(any())).thenAnswer(inv -> allStopped(inv.getArgument(0)));

        store = new EnvironmentCacheStore(tmp.resolve("cache/environments.json"),
                catalog.toAbsolutePath().normalize().toString());
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.now());
    }

    private ReconciliationEngine engine(Duration ttl, Duration checkInterval) {
        ConsoleMetrics metrics = new ConsoleMetrics(registry);
        return new ReconciliationEngine(catalog, ttl, checkInterval, new CatalogScanner(), store, probe,
                new OperationCoordinator(store, eventBus, metrics), eventBus, metrics, clock);
    }

    private ReconciliationEngine engine() {
        return engine(Duration.ofHours(24), Duration.ZERO);
    }

    private Path environment(String id, String compose) throws IOException {
        Path dir = catalog.resolve(id);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("docker-compose.yml"), compose);
        return dir;
    }

    private static Map<String, Boolean> allPresent(Set<String> refs) {
        return refs.stream().collect(Collectors.toMap(r -> r, r -> true));
    }

    private static Map<String, ContainerState> allStopped(Collection<String> ids) {
        return ids.stream().collect(Collectors.toMap(id -> id, id -> ContainerState.stopped()));
    }

    private static void deleteTree(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    private double rescans(String reason) {
        Counter counter = registry.find("vulnconsole.catalog.rescans").tag("reason", reason).counter();
        return counter == null ? 0 : counter.count();
    }

    private static List<String> ids(List<EnvironmentDescriptor> environments) {
        return environments.stream().map(EnvironmentDescriptor::id).toList();
    }

    @Nested
    @DisplayName("listing")
    class ListingTests {

        @Test
        @DisplayName("cold start rescans once and queries the runtime in one batch each")
        void coldStart() {
            List<EnvironmentDescriptor> envs = engine().getEnvironments(false);

            assertEquals(List.of(NGINX, PHP), ids(envs));
            assertTrue(envs.stream().allMatch(EnvironmentDescriptor::hasImages));
            assertTrue(envs.stream().allMatch(e -> e.status() == EnvironmentStatus.STOPPED));
            verify(probe, times(1)).imagesPresent(any());
            verify(probe, times(1)).containerStates(any());
            assertEquals(1.0, rescans("cold"));
            assertTrue(store.load().isPresent());
        }

        @Test
        @DisplayName("an unchanged catalog is served from the cache without runtime calls")
        void fastPath() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);

            List<EnvironmentDescriptor> again = engine.getEnvironments(false);

            assertEquals(List.of(NGINX, PHP), ids(again));
            verify(probe, times(1)).imagesPresent(any());
            verify(probe, times(1)).containerStates(any());
            assertEquals(1.0, registry.find("vulnconsole.catalog.fast_path").counter().count());
        }

        @Test
        @DisplayName("a fresh engine serves a warm cache written by an earlier process")
        void warmCacheAcrossInstances() {
            engine().getEnvironments(false);

            List<EnvironmentDescriptor> envs = engine().getEnvironments(false);

            assertEquals(2, envs.size());
            verify(probe, times(1)).containerStates(any());
        }

        @Test
        @DisplayName("a new environment on disk triggers a fingerprint rescan")
        void fingerprintChange() throws IOException {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            environment("redis/4-unacc", "services:\n  redis:\n    image: redis:4\n");

            List<EnvironmentDescriptor> envs = engine.getEnvironments(false);

            assertEquals(List.of(NGINX, PHP, "redis/4-unacc"), ids(envs));
            assertEquals(1.0, rescans("fingerprint"));
        }

        @Test
        @DisplayName("within the check interval a catalog edit is not yet noticed")
        void throttledFingerprint() throws IOException {
            ReconciliationEngine engine = engine(Duration.ofHours(24), Duration.ofSeconds(15));
            engine.getEnvironments(false);
            environment("redis/4-unacc", "services:\n  redis:\n    image: redis:4\n");

            assertEquals(2, engine.getEnvironments(false).size());

            clock.advance(Duration.ofSeconds(16));
            assertEquals(3, engine.getEnvironments(false).size());
        }

        @Test
        @DisplayName("a snapshot older than the TTL is rebuilt")
        void expired() {
            ReconciliationEngine engine = engine(Duration.ofHours(1), Duration.ofSeconds(15));
            engine.getEnvironments(false);

            clock.advance(Duration.ofHours(2));
            engine.getEnvironments(false);

            assertEquals(1.0, rescans("expired"));
            verify(probe, times(2)).containerStates(any());
        }

        @Test
        @DisplayName("a forced refresh always rescans")
        void forced() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);

            engine.getEnvironments(true);

            assertEquals(1.0, rescans("forced"));
            verify(probe, times(2)).imagesPresent(any());
        }

        @Test
        @DisplayName("an unreachable runtime leaves status unknown and images absent")
        void runtimeUnavailable() {
            doThrow(new RuntimeUnavailableException("daemon not running")).when(probe).imagesPresent(any());

            List<EnvironmentDescriptor> envs = engine().getEnvironments(false);

            assertEquals(2, envs.size());
            assertTrue(envs.stream().allMatch(e -> e.status() == EnvironmentStatus.UNKNOWN));
            assertTrue(envs.stream().noneMatch(EnvironmentDescriptor::hasImages));
        }

        @Test
        @DisplayName("a daemon-side API error degrades the listing instead of failing it")
        void runtimeApiError() {
            doThrow(new InternalServerErrorException("containerd down")).when(probe).imagesPresent(any());

            List<EnvironmentDescriptor> envs = engine().getEnvironments(false);

            assertEquals(List.of(NGINX, PHP), ids(envs));
            assertTrue(envs.stream().allMatch(e -> e.status() == EnvironmentStatus.UNKNOWN));
            assertTrue(envs.stream().noneMatch(EnvironmentDescriptor::hasImages));
            assertTrue(store.load().isPresent());
        }

        @Test
        @DisplayName("an environment removed from disk disappears after the fingerprint rescan")
        void removedEnvironment() throws IOException {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            deleteTree(catalog.resolve(PHP));

            List<EnvironmentDescriptor> envs = engine.getEnvironments(false);

            assertEquals(List.of(NGINX), ids(envs));
            assertEquals(1.0, rescans("fingerprint"));
            assertTrue(store.load().orElseThrow().find(PHP).isEmpty());
            assertTrue(engine.getEnvironment(PHP).isEmpty());
        }

        @Test
        @DisplayName("observed ports of running environments override the declared ones")
        void observedPortsOnRescan() {
            doReturn(Map.of(
                    NGINX, new ContainerState(EnvironmentStatus.RUNNING, Map.of("web", 18080)),
                    PHP, ContainerState.stopped())).when(probe).containerStates(any());

            EnvironmentDescriptor nginx = engine().getEnvironment(NGINX).orElseThrow();

            assertEquals(EnvironmentStatus.RUNNING, nginx.status());
            assertEquals(18080, nginx.primaryPort());
        }

        @Test
        @DisplayName("stats count statuses, exploits, images and categories")
        void stats() throws IOException {
            Path dir = catalog.resolve(NGINX);
            Files.createDirectories(dir.resolve("poc"));
            Files.writeString(dir.resolve("poc/check.py"), "print()");
            doReturn(Map.of(NGINX, new ContainerState(EnvironmentStatus.RUNNING, Map.of())))
                    .when(probe).containerStates(any());

            CatalogStats stats = engine().stats();

            assertEquals(2, stats.total());
            assertEquals(1, stats.running());
            assertEquals(0, stats.stopped());
            assertEquals(1, stats.unknown());
            assertEquals(1, stats.withExploit());
            assertEquals(2, stats.withImages());
            assertEquals(Map.of("nginx", 1, "php", 1), stats.categories());
        }
    }

    @Nested
    @DisplayName("start and stop")
    class StartStopTests {

        @Test
        @DisplayName("a successful start patches only that entry to running with observed ports")
        void startPatchesEntry() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(NGINX)).thenReturn(RuntimeOutcome.ok());
            when(probe.containerState(NGINX))
                    .thenReturn(new ContainerState(EnvironmentStatus.RUNNING, Map.of("web", 8080)));

            OperationResult result = engine.start(NGINX);

            assertEquals(OperationResult.Kind.SUCCESS, result.kind());
            assertEquals(EnvironmentStatus.RUNNING, result.environment().status());
            assertEquals(EnvironmentStatus.RUNNING, engine.getEnvironment(NGINX).orElseThrow().status());
            assertEquals(EnvironmentStatus.STOPPED, engine.getEnvironment(PHP).orElseThrow().status());
            assertEquals(8080, engine.getEnvironment(NGINX).orElseThrow().primaryPort());
            // listing after the patch stays on the fast path
            verify(probe, times(1)).containerStates(any());
        }

        @Test
        @DisplayName("a port conflict keeps the status and records the error")
        void portConflict() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(PHP)).thenReturn(RuntimeOutcome.conflict(
                    "Host port already in use by nginx-web-1", List.of("nginx-web-1")));

            OperationResult result = engine.start(PHP);

            assertEquals(OperationResult.Kind.PORT_CONFLICT, result.kind());
            assertTrue(result.portConflict());
            assertFalse(result.success());
            assertEquals(List.of("nginx-web-1"), result.conflicting());
            EnvironmentDescriptor php = engine.getEnvironment(PHP).orElseThrow();
            assertEquals(EnvironmentStatus.STOPPED, php.status());
            assertEquals("Host port already in use by nginx-web-1", php.lastError());
        }

        @Test
        @DisplayName("a plain runtime failure is reported as failure")
        void startFailure() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(NGINX)).thenReturn(RuntimeOutcome.failed("manifest unknown"));

            OperationResult result = engine.start(NGINX);

            assertEquals(OperationResult.Kind.FAILURE, result.kind());
            assertEquals("manifest unknown", engine.getEnvironment(NGINX).orElseThrow().lastError());
        }

        @Test
        @DisplayName("stop patches the entry to stopped and clears the last error")
        void stop() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(NGINX)).thenReturn(RuntimeOutcome.failed("boom"));
            engine.start(NGINX);
            when(probe.stop(NGINX)).thenReturn(RuntimeOutcome.ok());

            OperationResult result = engine.stop(NGINX);

            assertEquals(OperationResult.Kind.SUCCESS, result.kind());
            EnvironmentDescriptor nginx = engine.getEnvironment(NGINX).orElseThrow();
            assertEquals(EnvironmentStatus.STOPPED, nginx.status());
            assertNull(nginx.lastError());
        }

        @Test
        @DisplayName("a start that completes while a rescan is reading the runtime survives the rescan")
        void startDuringRescan() throws Exception {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(NGINX)).thenReturn(RuntimeOutcome.ok());
            when(probe.containerState(NGINX))
                    .thenReturn(new ContainerState(EnvironmentStatus.RUNNING, Map.of("web", 8080)));
            var queried = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            doAnswer(inv -> {
                queried.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
                return allStopped(inv.getArgument(0));
            }).when(probe).containerStates(any());
            var refreshed = new AtomicReference<List<EnvironmentDescriptor>>();
            Thread refresh = new Thread(() -> refreshed.set(engine.getEnvironments(true)));
            refresh.start();
            assertTrue(queried.await(5, TimeUnit.SECONDS));

            assertEquals(OperationResult.Kind.SUCCESS, engine.start(NGINX).kind());
            release.countDown();
            refresh.join(5000);

            assertFalse(refresh.isAlive());
            assertEquals(EnvironmentStatus.RUNNING, refreshed.get().get(0).status());
            assertEquals(EnvironmentStatus.RUNNING, engine.getEnvironment(NGINX).orElseThrow().status());
            assertEquals(EnvironmentStatus.STOPPED, engine.getEnvironment(PHP).orElseThrow().status());
        }

        @Test
        @DisplayName("unknown or escaping ids are not found and never reach the runtime")
        void notFound() {
            ReconciliationEngine engine = engine();

            assertEquals(OperationResult.Kind.NOT_FOUND, engine.start("nginx/nope").kind());
            assertEquals(OperationResult.Kind.NOT_FOUND, engine.start("../etc").kind());
            assertEquals(OperationResult.Kind.NOT_FOUND, engine.stop("nginx").kind());
            verify(probe, never()).start(anyString());
            verify(probe, never()).stop(anyString());
        }

        @Test
        @DisplayName("an unreachable runtime during start is reported as such")
        void runtimeUnavailable() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            when(probe.start(NGINX)).thenThrow(new RuntimeUnavailableException("daemon not running"));

            OperationResult result = engine.start(NGINX);

            assertEquals(OperationResult.Kind.RUNTIME_UNAVAILABLE, result.kind());
            assertEquals(EnvironmentStatus.STOPPED, engine.getEnvironment(NGINX).orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("images")
    class ImageTests {

        @Test
        @DisplayName("missing images are the declared ones absent locally")
        void missingImages() throws IOException {
            environment("multi/env", "services:\n  a:\n    image: alpine:3\n  b:\n    image: busybox\n");
            doReturn(Map.of("alpine:3", true, "busybox", false)).when(probe).imagesPresent(any());

            MissingImages missing = engine().missingImages("multi/env").orElseThrow();

            assertTrue(missing.success());
            assertEquals(List.of("alpine:3", "busybox"), missing.images());
            assertEquals(List.of("busybox"), missing.missing());
        }

        @Test
        @DisplayName("missing images of an unknown id is empty")
        void missingImagesUnknown() {
            assertTrue(engine().missingImages("nope/nope").isEmpty());
        }

        @Test
        @DisplayName("missing images reports an unreachable runtime")
        void missingImagesRuntimeDown() {
            doThrow(new RuntimeUnavailableException("down")).when(probe).imagesPresent(any());

            MissingImages missing = engine().missingImages(NGINX).orElseThrow();

            assertFalse(missing.success());
            assertEquals("down", missing.message());
        }

        @Test
        @DisplayName("missing images reports a daemon-side API error as runtime unavailable")
        void missingImagesApiError() {
            doThrow(new InternalServerErrorException("containerd down")).when(probe).imagesPresent(any());

            MissingImages missing = engine().missingImages(NGINX).orElseThrow();

            assertFalse(missing.success());
            assertTrue(missing.runtimeUnavailable());
            assertEquals(List.of("nginx:1.20"), missing.images());
        }

        @Test
        @DisplayName("missing images of an unparseable composition file is a plain failure")
        void missingImagesUnparseable() throws IOException {
            environment("broken/env", "services: [unclosed\n");

            MissingImages missing = engine().missingImages("broken/env").orElseThrow();

            assertFalse(missing.success());
            assertFalse(missing.runtimeUnavailable());
            verify(probe, never()).imagesPresent(any());
        }

        @Test
        @DisplayName("pull streams progress and ends with one completion event")
        void pull() throws InterruptedException {
            ReconciliationEngine engine = engine();
            doReturn(Map.of("nginx:1.20", false)).when(probe).imagesPresent(any());
            engine.getEnvironments(false);
            doReturn(Map.of("nginx:1.20", false), Map.of("nginx:1.20", true)).when(probe).imagesPresent(any());
            when(probe.pull(eq("nginx:1.20"), any())).thenAnswer(inv -> {
                Consumer<String> progress = inv.getArgument(1);
                progress.accept("1.20: Pulling from library/nginx");
                return true;
            });
            var events = new CopyOnWriteArrayList<ConsoleEvent>();
            var done = new CountDownLatch(1);
            eventBus.subscribe(NGINX, e -> {
                events.add(e);
                if (e.isTerminal()) done.countDown();
            });

            OperationResult result = engine.pullImages(NGINX);

            assertEquals(OperationResult.Kind.ACCEPTED, result.kind());
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(ConsoleEvent.OPERATION_STARTED, events.get(0).eventType());
            assertEquals(ConsoleEvent.OPERATION_COMPLETED, events.get(events.size() - 1).eventType());
            assertEquals(List.of("Pulling nginx:1.20", "1.20: Pulling from library/nginx", "Pulled nginx:1.20"),
                    events.stream()
                            .filter(e -> ConsoleEvent.PULL_LOG.equals(e.eventType()))
                            .map(e -> e.payload().get("line"))
                            .toList());
            assertEquals(1, events.stream().filter(ConsoleEvent::isTerminal).count());
            assertTrue(store.load().orElseThrow().find(NGINX).orElseThrow().hasImages());
        }

        @Test
        @DisplayName("a failed pull ends with a failure event and records the error")
        void pullFailure() throws InterruptedException {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);
            doReturn(Map.of("nginx:1.20", false)).when(probe).imagesPresent(any());
            when(probe.pull(eq("nginx:1.20"), any())).thenReturn(false);
            var terminal = new CopyOnWriteArrayList<ConsoleEvent>();
            var done = new CountDownLatch(1);
            eventBus.subscribe(NGINX, e -> {
                if (e.isTerminal()) {
                    terminal.add(e);
                    done.countDown();
                }
            });

            engine.pullImages(NGINX);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(ConsoleEvent.OPERATION_FAILED, terminal.get(0).eventType());
            EnvironmentDescriptor nginx = store.load().orElseThrow().find(NGINX).orElseThrow();
            assertFalse(nginx.hasImages());
            assertEquals("Failed to pull nginx:1.20", nginx.lastError());
        }

        @Test
        @DisplayName("pull of an unknown id is not found")
        void pullUnknown() {
            assertEquals(OperationResult.Kind.NOT_FOUND, engine().pullImages("nope/nope").kind());
        }
    }

    @Nested
    @DisplayName("detail and exploits")
    class DetailTests {

        @Test
        @DisplayName("detail carries the cached descriptor and the composition file text")
        void detail() {
            ReconciliationEngine engine = engine();
            engine.getEnvironments(false);

            EnvironmentDetail detail = engine.detail(NGINX).orElseThrow();

            assertEquals(engine.getEnvironment(NGINX).orElseThrow(), detail.environment());
            assertTrue(detail.compose().contains("image: nginx:1.20"));
        }

        @Test
        @DisplayName("exploits are read from disk with their usage line")
        void exploits() throws IOException {
            Path dir = catalog.resolve(NGINX);
            Files.createDirectories(dir.resolve("poc"));
            Files.writeString(dir.resolve("poc/check.py"), "#!/usr/bin/env python3\n# Usage: check.py <host>\nprint()\n");

            List<ExploitFile> exploits = engine().exploits(NGINX).orElseThrow();

            assertEquals(1, exploits.size());
            assertEquals("poc/check.py", exploits.get(0).path());
            assertEquals("# Usage: check.py <host>", exploits.get(0).usage());
        }

        @Test
        @DisplayName("unknown ids are empty")
        void unknown() {
            assertTrue(engine().detail("nope/nope").isEmpty());
            assertTrue(engine().exploits("../etc").isEmpty());
        }
    }

    @Nested
    @DisplayName("two-environment catalog")
    class ScenarioTests {

        private static final String PLAIN = "nginx/cve-2021-x";
        private static final String EXPLOITED = "apache/cve-2022-y";

        @BeforeEach
        void scenarioCatalog() throws IOException {
            catalog = tmp.resolve("scenario");
            environment(PLAIN, "services:\n  web:\n    image: nginx:1.21\n");
            Path apache = environment(EXPLOITED,
                    "services:\n  web:\n    image: httpd:2.4.49\n    ports:\n      - \"8080:80\"\n");
            Files.writeString(apache.resolve("exploit.py"), "print('pwn')\n");
            store = spy(new EnvironmentCacheStore(tmp.resolve("scenario-cache.json"),
                    catalog.toAbsolutePath().normalize().toString()));

            doAnswer(inv -> {
                Set<String> refs = inv.getArgument(0);
                return refs.stream().collect(Collectors.toMap(r -> r, "httpd:2.4.49"::equals));
            }).when(probe).imagesPresent(any());
            doAnswer(inv -> {
                Collection<String> ids = inv.getArgument(0);
                return ids.stream().collect(Collectors.toMap(id -> id, id -> EXPLOITED.equals(id)
                        ? new ContainerState(EnvironmentStatus.RUNNING, Map.of("web", 8080))
                        : ContainerState.stopped()));
            }).when(probe).containerStates(any());
        }

        @Test
        @DisplayName("a forced rescan mixes exploit, image and container state per environment")
        void forcedRescan() {
            List<EnvironmentDescriptor> envs = engine().getEnvironments(true);

            assertEquals(List.of(EXPLOITED, PLAIN), ids(envs));
            EnvironmentDescriptor apache = envs.get(0);
            EnvironmentDescriptor nginx = envs.get(1);
            assertFalse(nginx.hasExploit());
            assertTrue(apache.hasExploit());
            assertFalse(nginx.hasImages());
            assertTrue(apache.hasImages());
            assertEquals(EnvironmentStatus.STOPPED, nginx.status());
            assertEquals(EnvironmentStatus.RUNNING, apache.status());
            assertEquals(Map.of("web", 8080), apache.services());
        }

        @Test
        @DisplayName("starting the first environment patches it once and leaves the second untouched")
        void startAfterRescan() {
            ReconciliationEngine engine = engine();
            EnvironmentDescriptor apacheBefore = engine.getEnvironments(true).get(0);
            when(probe.start(PLAIN)).thenReturn(RuntimeOutcome.ok());
            when(probe.containerState(PLAIN)).thenReturn(new ContainerState(EnvironmentStatus.RUNNING, Map.of()));

            OperationResult result = engine.start(PLAIN);

            assertEquals(OperationResult.Kind.SUCCESS, result.kind());
            assertEquals(EnvironmentStatus.RUNNING, engine.getEnvironment(PLAIN).orElseThrow().status());
            assertEquals(apacheBefore, engine.getEnvironment(EXPLOITED).orElseThrow());
            verify(store, times(1)).patch(eq(PLAIN), any());
            verify(store, never()).patch(eq(EXPLOITED), any());
            verify(probe, times(1)).containerStates(any());
        }
    }

    @Nested
    @DisplayName("waitReady")
    class WaitReadyTests {

        @Test
        @DisplayName("ready as soon as the primary port accepts connections")
        void ready() throws IOException {
            try (ServerSocket server = new ServerSocket(0)) {
                int port = server.getLocalPort();
                environment("live/env", "services:\n  app:\n    image: alpine:3\n    ports:\n      - \"" + port + ":80\"\n");

                ReadinessResult result = engine().waitReady("live/env", Duration.ofSeconds(5)).orElseThrow();

                assertTrue(result.ready());
                assertEquals(port, result.port());
                assertNull(MDC.get("envId"));
            }
        }

        @Test
        @DisplayName("an environment without published ports is never ready")
        void noPort() throws IOException {
            environment("worker/env", "services:\n  worker:\n    image: alpine:3\n");

            ReadinessResult result = engine().waitReady("worker/env", Duration.ofSeconds(1)).orElseThrow();

            assertFalse(result.ready());
            assertNull(result.port());
        }

        @Test
        @DisplayName("unknown ids are empty")
        void unknown() {
            assertTrue(engine().waitReady("nope/nope", Duration.ofSeconds(1)).isEmpty());
        }
    }

    /** Clock the tests can move forward. */
    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
