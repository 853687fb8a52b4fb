package com.vulnconsole.core.engine;

import com.vulnconsole.core.ConsoleProperties;
import com.vulnconsole.core.cache.EnvironmentCacheStore;
import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.logging.MdcContext;
import com.vulnconsole.core.metrics.ConsoleMetrics;
import com.vulnconsole.core.model.CatalogSnapshot;
import com.vulnconsole.core.model.CatalogStats;
import com.vulnconsole.core.model.ContainerState;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentDetail;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.model.ExploitFile;
import com.vulnconsole.core.model.MissingImages;
import com.vulnconsole.core.model.ReadinessResult;
import com.vulnconsole.core.model.RunningContainer;
import com.vulnconsole.core.operations.OperationCoordinator;
import com.vulnconsole.core.operations.OperationOutcome;
import com.vulnconsole.core.operations.OperationResult;
import com.vulnconsole.core.scanner.CatalogEntry;
import com.vulnconsole.core.scanner.CatalogScanner;
import com.vulnconsole.core.scanner.CompositionParseException;
import com.vulnconsole.runtime.RuntimeOutcome;
import com.vulnconsole.runtime.RuntimeProbe;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when the cached catalog can be served as-is and when it must be rebuilt,
 * and runs environment operations against the container runtime.
 * <p>
 * The fast path loads the cache and compares its fingerprint with a cheap
 * directory-and-stat fingerprint of the catalog. That comparison is throttled to
 * once per {@code fingerprint-check-interval}, so a listing served within the
 * interval can miss a catalog edit made since the last check. A rescan parses
 * everything and asks the runtime about all images and all containers in one
 * batched call each.
 * <p>
 * Start, stop and pull go through the {@link OperationCoordinator}, which owns
 * per-environment exclusivity and the single post-operation cache patch.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final String READY_HOST = "127.0.0.1";
    private static final Duration READY_POLL_INTERVAL = Duration.ofSeconds(1);
    private static final int READY_CONNECT_TIMEOUT_MS = 1000;

    private final Path catalogRoot;
    private final Duration cacheTtl;
    private final Duration fingerprintCheckInterval;
    private final CatalogScanner scanner;
    private final EnvironmentCacheStore store;
    private final RuntimeProbe probe;
    private final OperationCoordinator coordinator;
    private final EventBus eventBus;
    private final ConsoleMetrics metrics;
    private final Clock clock;

    /** When the on-disk fingerprint last matched the cache. */
    private final AtomicReference<Instant> lastFingerprintMatch = new AtomicReference<>();
    private final ReentrantLock rescanLock = new ReentrantLock();

    @Autowired
    public ReconciliationEngine(ConsoleProperties properties, CatalogScanner scanner, EnvironmentCacheStore store,
                                RuntimeProbe probe, OperationCoordinator coordinator, EventBus eventBus,
                                @Autowired(required = false) ConsoleMetrics metrics) {
        this(properties.getCatalogRoot(), properties.getCacheTtl(), properties.getFingerprintCheckInterval(),
                scanner, store, probe, coordinator, eventBus, metrics, Clock.systemUTC());
    }

    ReconciliationEngine(Path catalogRoot, Duration cacheTtl, Duration fingerprintCheckInterval,
                         CatalogScanner scanner, EnvironmentCacheStore store, RuntimeProbe probe,
                         OperationCoordinator coordinator, EventBus eventBus, ConsoleMetrics metrics, Clock clock) {
        this.catalogRoot = catalogRoot.toAbsolutePath().normalize();
        this.cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        this.fingerprintCheckInterval = fingerprintCheckInterval == null ? Duration.ZERO : fingerprintCheckInterval;
        this.scanner = scanner;
        this.store = store;
        this.probe = probe;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    // -- Listing --

    /**
     * Returns every environment ordered by id.
     *
     * @param forceRescan skip the cache and rebuild from disk and runtime
     */
    public List<EnvironmentDescriptor> getEnvironments(boolean forceRescan) {
        return snapshot(forceRescan).orderedEnvironments();
    }

    public Optional<EnvironmentDescriptor> getEnvironment(String id) {
        return snapshot(false).find(id);
    }

    /**
     * Returns the current snapshot, rescanning when forced or when the cache is
     * cold, expired or no longer matches the catalog on disk.
     */
    public CatalogSnapshot snapshot(boolean forceRescan) {
        if (!forceRescan) {
            Optional<CatalogSnapshot> cached = store.load();
            if (staleReason(cached) == null) {
                if (metrics != null) {
                    metrics.recordFastPath();
                }
                return cached.get();
            }
        }
        rescanLock.lock();
        try {
            String reason = "forced";
            if (!forceRescan) {
                // Another caller may have rebuilt the cache while we waited
                Optional<CatalogSnapshot> cached = store.load();
                reason = staleReason(cached);
                if (reason == null) {
                    return cached.get();
                }
            }
            return rescan(reason);
        } finally {
            rescanLock.unlock();
        }
    }

    /**
     * Returns the descriptor of one environment with its composition file text.
     * An environment on disk that the cached snapshot does not know yet is
     * described from disk.
     *
     * @return empty if the id is unknown
     */
    public Optional<EnvironmentDetail> detail(String id) {
        Optional<CatalogEntry> entry = scanner.entryFor(catalogRoot, id);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        EnvironmentDescriptor descriptor = getEnvironment(id)
                .orElseGet(() -> scanner.describe(entry.get(), clock.instant()));
        return Optional.of(new EnvironmentDetail(descriptor, scanner.composeText(entry.get()).orElse(null)));
    }

    /**
     * Reads the exploit scripts of one environment.
     *
     * @return empty if the id is unknown
     */
    public Optional<List<ExploitFile>> exploits(String id) {
        return scanner.entryFor(catalogRoot, id).map(scanner::exploits);
    }

    public CatalogStats stats() {
        List<EnvironmentDescriptor> environments = getEnvironments(false);
        int running = 0, stopped = 0, unknown = 0, withExploit = 0, withImages = 0;
        var categories = new TreeMap<String, Integer>();
        for (EnvironmentDescriptor env : environments) {
            switch (env.status()) {
                case RUNNING -> running++;
                case STOPPED -> stopped++;
                default -> unknown++;
            }
            if (env.hasExploit()) withExploit++;
            if (env.hasImages()) withImages++;
            categories.merge(env.category(), 1, Integer::sum);
        }
        return new CatalogStats(environments.size(), running, stopped, unknown, withExploit, withImages, categories);
    }

    // -- Operations --

    public OperationResult start(String id) {
        if (scanner.entryFor(catalogRoot, id).isEmpty()) {
            return OperationResult.notFound(id, "start");
        }
        return coordinator.withLock(id, "start", () -> {
            RuntimeOutcome outcome = probe.start(id);
            Instant now = clock.instant();
            if (outcome.success()) {
                Map<String, Integer> observed = observedPorts(id);
                return new OperationOutcome(OperationResult.success(id, "start"),
                        d -> d.withStatus(EnvironmentStatus.RUNNING, now).withObservedPorts(observed));
            }
            OperationResult result = outcome.portConflict()
                    ? OperationResult.portConflict(id, outcome.message(), outcome.conflicting())
                    : OperationResult.failure(id, "start", outcome.message());
            return new OperationOutcome(result, d -> d.withError(outcome.message(), now));
        });
    }

    public OperationResult stop(String id) {
        if (scanner.entryFor(catalogRoot, id).isEmpty()) {
            return OperationResult.notFound(id, "stop");
        }
        return coordinator.withLock(id, "stop", () -> {
            RuntimeOutcome outcome = probe.stop(id);
            Instant now = clock.instant();
            if (outcome.success()) {
                return new OperationOutcome(OperationResult.success(id, "stop"),
                        d -> d.withStatus(EnvironmentStatus.STOPPED, now));
            }
            return new OperationOutcome(OperationResult.failure(id, "stop", outcome.message()),
                    d -> d.withError(outcome.message(), now));
        });
    }

    /**
     * Re-reads the environment's composition file and reports which of its images
     * are absent locally.
     *
     * @return empty if the id is unknown
     */
    public Optional<MissingImages> missingImages(String id) {
        Optional<CatalogEntry> entry = scanner.entryFor(catalogRoot, id);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        List<String> images;
        try {
            images = scanner.compose(entry.get()).images();
        } catch (CompositionParseException e) {
            return Optional.of(MissingImages.unparseable(id, e.getMessage()));
        }
        try {
            return Optional.of(MissingImages.of(id, images, absent(images)));
        } catch (RuntimeUnavailableException e) {
            log.warn("Cannot check images of {}: {}", id, e.getMessage());
            return Optional.of(MissingImages.unavailable(id, images, e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Image query for {} failed", id, e);
            return Optional.of(MissingImages.unavailable(id, images, e.getMessage()));
        }
    }

    /**
     * Pulls the environment's missing images in the background.
     * Progress arrives as {@code pull.log} events on the {@link EventBus}, followed
     * by {@code operation.completed} or {@code operation.failed}.
     *
     * @return {@code ACCEPTED}, {@code BUSY} or {@code NOT_FOUND}
     */
    public OperationResult pullImages(String id) {
        Optional<CatalogEntry> entry = scanner.entryFor(catalogRoot, id);
        if (entry.isEmpty()) {
            return OperationResult.notFound(id, "pull");
        }
        return coordinator.submit(id, "pull", () -> pull(id, entry.get()));
    }

    private OperationOutcome pull(String id, CatalogEntry entry) {
        long started = System.nanoTime();
        List<String> images;
        try {
            images = scanner.compose(entry).images();
        } catch (CompositionParseException e) {
            String message = "Cannot parse composition file: " + e.getMessage();
            return new OperationOutcome(OperationResult.failure(id, "pull", message),
                    d -> d.withError(message, clock.instant()));
        }

        List<String> missing = absent(images);
        if (missing.isEmpty()) {
            progress(id, "All images already present");
        }
        var failed = new ArrayList<String>();
        for (String image : missing) {
            progress(id, "Pulling " + image);
            if (probe.pull(image, line -> progress(id, line))) {
                progress(id, "Pulled " + image);
            } else {
                failed.add(image);
            }
        }

        boolean present = !images.isEmpty() && absent(images).isEmpty();
        Instant now = clock.instant();
        if (metrics != null) {
            metrics.recordPullDuration((System.nanoTime() - started) / 1_000_000);
        }
        if (failed.isEmpty()) {
            return new OperationOutcome(OperationResult.success(id, "pull"),
                    d -> d.withImages(images, present, now).withError(null, now));
        }
        String message = "Failed to pull " + String.join(", ", failed);
        return new OperationOutcome(OperationResult.failure(id, "pull", message),
                d -> d.withImages(images, present, now).withError(message, now));
    }

    /**
     * Polls the first published host port of the environment until it accepts a
     * TCP connection or {@code timeout} elapses.
     *
     * @return empty if the id is unknown
     */
    public Optional<ReadinessResult> waitReady(String id, Duration timeout) {
        Optional<EnvironmentDescriptor> env = getEnvironment(id);
        if (env.isEmpty()) {
            return Optional.empty();
        }
        Integer port = env.get().primaryPort();
        if (port == null) {
            return Optional.of(new ReadinessResult(id, false, null, 0, "Environment publishes no host port"));
        }
        MdcContext.setEnvironment(id);
        try {
            return Optional.of(pollPort(id, port, timeout));
        } finally {
            MdcContext.clear();
        }
    }

    private ReadinessResult pollPort(String id, int port, Duration timeout) {
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        while (true) {
            if (isListening(port)) {
                long waited = (System.nanoTime() - startedAt) / 1_000_000;
                log.info("{} ready on port {} after {}ms", id, port, waited);
                return new ReadinessResult(id, true, port, waited, null);
            }
            if (System.nanoTime() >= deadline) {
                long waited = (System.nanoTime() - startedAt) / 1_000_000;
                log.info("{} not ready on port {} after {}ms", id, port, waited);
                return new ReadinessResult(id, false, port, waited,
                        "Port " + port + " not reachable within " + timeout.toSeconds() + "s");
            }
            try {
                Thread.sleep(READY_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new ReadinessResult(id, false, port,
                        (System.nanoTime() - startedAt) / 1_000_000, "Interrupted");
            }
        }
    }

    /**
     * Lists every running container on the host.
     *
     * @throws RuntimeUnavailableException if the runtime cannot be reached
     */
    public List<RunningContainer> runningContainers() {
        return probe.runningContainers();
    }

    // -- Internals --

    /**
     * Returns why the cached snapshot cannot be served, or {@code null} if it can.
     */
    private String staleReason(Optional<CatalogSnapshot> cached) {
        if (cached.isEmpty()) {
            return "cold";
        }
        Instant now = clock.instant();
        CatalogSnapshot snapshot = cached.get();
        if (!cacheTtl.isZero() && snapshot.generatedAt() != null
                && snapshot.generatedAt().plus(cacheTtl).isBefore(now)) {
            log.info("Cache generated at {} is older than {}", snapshot.generatedAt(), cacheTtl);
            return "expired";
        }
        Instant lastMatch = lastFingerprintMatch.get();
        if (lastMatch != null && !fingerprintCheckInterval.isZero()
                && Duration.between(lastMatch, now).compareTo(fingerprintCheckInterval) < 0) {
            return null;
        }
        String current = scanner.fingerprint(catalogRoot);
        if (!current.equals(snapshot.catalogFingerprint())) {
            log.info("Catalog changed on disk, cache fingerprint is stale");
            return "fingerprint";
        }
        lastFingerprintMatch.set(now);
        return null;
    }

    private CatalogSnapshot rescan(String reason) {
        log.info("Rescanning catalog {} ({})", catalogRoot, reason);
        long started = System.nanoTime();
        long patchMark = store.patchMark();
        CatalogSnapshot scanned = scanner.scan(catalogRoot);

        Map<String, Boolean> present = Map.of();
        Map<String, ContainerState> states = Map.of();
        try {
            present = probe.imagesPresent(new LinkedHashSet<>(scanned.allImages()));
            states = probe.containerStates(scanned.environments().keySet());
        } catch (RuntimeUnavailableException e) {
            log.warn("Container runtime unavailable during rescan, status left unknown: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Container runtime query failed during rescan, status left unknown", e);
        }

        Instant now = clock.instant();
        var descriptors = new ArrayList<EnvironmentDescriptor>(scanned.environments().size());
        for (EnvironmentDescriptor env : scanned.orderedEnvironments()) {
            Map<String, Boolean> imageState = present;
            boolean hasImages = !env.images().isEmpty()
                    && env.images().stream().allMatch(image -> imageState.getOrDefault(image, false));
            EnvironmentDescriptor updated = env.withImagesPresent(hasImages);
            ContainerState state = states.get(env.id());
            if (state != null) {
                updated = updated.withStatus(state.status(), now).withObservedPorts(state.services());
            }
            descriptors.add(updated);
        }
        CatalogSnapshot snapshot = CatalogSnapshot.of(
                scanned.catalogFingerprint(), scanned.generatedAt(), scanned.catalogRoot(), descriptors);

        try {
            snapshot = store.saveScan(snapshot, patchMark);
        } catch (UncheckedIOException e) {
            log.warn("Could not persist catalog cache, serving the fresh scan anyway: {}", e.getMessage());
        }
        lastFingerprintMatch.set(now);

        long ms = (System.nanoTime() - started) / 1_000_000;
        log.info("Rescan finished: {} environments in {}ms", descriptors.size(), ms);
        if (metrics != null) {
            metrics.recordRescan(reason, ms);
        }
        return snapshot;
    }

    private Map<String, Integer> observedPorts(String id) {
        try {
            ContainerState state = probe.containerState(id);
            return state == null ? Map.of() : state.services();
        } catch (RuntimeException e) {
            log.debug("Could not read published ports of {}: {}", id, e.getMessage());
            return Map.of();
        }
    }

    private List<String> absent(List<String> images) {
        if (images.isEmpty()) {
            return List.of();
        }
        Map<String, Boolean> present = probe.imagesPresent(new LinkedHashSet<>(images));
        return images.stream().filter(image -> !present.getOrDefault(image, false)).toList();
    }

    private void progress(String id, String line) {
        eventBus.publish(ConsoleEvent.of(ConsoleEvent.PULL_LOG, id, Map.of("line", line)));
    }

    private static boolean isListening(int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(READY_HOST, port), READY_CONNECT_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
