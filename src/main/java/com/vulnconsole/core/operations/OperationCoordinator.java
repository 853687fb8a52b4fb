package com.vulnconsole.core.operations;

import com.vulnconsole.core.cache.EnvironmentCacheStore;
import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.logging.MdcContext;
import com.vulnconsole.core.metrics.ConsoleMetrics;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.runtime.RuntimeUnavailableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serialises start/stop/pull per environment and applies the post-operation cache patch.
 * <p>
 * At most one operation is in flight per environment id. A second request for the
 * same id is rejected at once with {@link OperationResult.Kind#BUSY}; requests for
 * different ids never wait on each other. When an operation finishes, successfully
 * or not, exactly one {@link EnvironmentCacheStore#patch} is applied for its id and
 * only then is the id released.
 * <p>
 * Lifecycle events ({@code operation.started}, {@code operation.completed},
 * {@code operation.failed}) are published on the {@link EventBus}; the operation
 * itself may publish progress events in between.
 */
@Service
public class OperationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(OperationCoordinator.class);

    /** Ids with an operation in flight. Entries are removed on release. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final EnvironmentCacheStore store;
    private final EventBus eventBus;
    private final ConsoleMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public OperationCoordinator(EnvironmentCacheStore store, EventBus eventBus,
                                @Autowired(required = false) ConsoleMetrics metrics) {
        this(store, eventBus, metrics, Executors.newCachedThreadPool(daemonThreads()));
    }

    OperationCoordinator(EnvironmentCacheStore store, EventBus eventBus,
                         ConsoleMetrics metrics, ExecutorService executor) {
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Runs {@code action} on the calling thread while holding the id.
     *
     * @return the action's result with the patched descriptor attached, or a
     *         {@code BUSY} result if the id is already held
     */
    public OperationResult withLock(String environmentId, String operation, Supplier<OperationOutcome> action) {
        if (!tryAcquire(environmentId)) {
            return busy(environmentId, operation);
        }
        try {
            return runAndPatch(environmentId, operation, action);
        } finally {
            release(environmentId);
        }
    }

    /**
     * Acquires the id on the calling thread and runs {@code action} in the background.
     * The caller learns the outcome from the {@code operation.completed} or
     * {@code operation.failed} event.
     *
     * @return {@code ACCEPTED}, or {@code BUSY} if the id is already held
     */
    public OperationResult submit(String environmentId, String operation, Supplier<OperationOutcome> action) {
        if (!tryAcquire(environmentId)) {
            return busy(environmentId, operation);
        }
        try {
            executor.execute(() -> {
                try {
                    runAndPatch(environmentId, operation, action);
                } finally {
                    release(environmentId);
                }
            });
        } catch (RejectedExecutionException e) {
            release(environmentId);
            log.warn("Could not schedule {} for {}: {}", operation, environmentId, e.getMessage());
            return OperationResult.failure(environmentId, operation, "Operation executor is shut down");
        }
        return OperationResult.accepted(environmentId, operation);
    }

    /** True while an operation holds the id. */
    public boolean isBusy(String environmentId) {
        return inFlight.contains(environmentId);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private OperationResult runAndPatch(String environmentId, String operation, Supplier<OperationOutcome> action) {
        MdcContext.setOperation(environmentId, operation);
        try {
            log.info("{} {} started", operation, environmentId);
            publish(ConsoleEvent.OPERATION_STARTED, environmentId, operation, null, null);

            OperationOutcome outcome;
            try {
                outcome = action.get();
            } catch (RuntimeUnavailableException e) {
                log.warn("{} {} failed: container runtime unavailable: {}", operation, environmentId, e.getMessage());
                outcome = failedOutcome(OperationResult.runtimeUnavailable(environmentId, operation, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("{} {} failed unexpectedly", operation, environmentId, e);
                outcome = failedOutcome(OperationResult.failure(environmentId, operation, e.getMessage()));
            }

            OperationResult result = outcome.result();
            Optional<EnvironmentDescriptor> patched = applyPatch(environmentId, outcome);
            if (patched.isPresent()) {
                result = result.withEnvironment(patched.get());
            }

            String kind = result.kind().name().toLowerCase();
            if (result.success()) {
                log.info("{} {} completed", operation, environmentId);
                publish(ConsoleEvent.OPERATION_COMPLETED, environmentId, operation, kind, result.message());
            } else {
                log.warn("{} {} ended with {}: {}", operation, environmentId, kind, result.message());
                publish(ConsoleEvent.OPERATION_FAILED, environmentId, operation, kind, result.message());
            }
            if (metrics != null) {
                metrics.recordOperation(operation, kind);
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<EnvironmentDescriptor> applyPatch(String environmentId, OperationOutcome outcome) {
        if (outcome.patch() == null) {
            return Optional.empty();
        }
        try {
            return store.patch(environmentId, outcome.patch());
        } catch (RuntimeException e) {
            // The operation already happened; the next rescan will pick up the state
            log.warn("Cache patch for {} failed: {}", environmentId, e.getMessage());
            return Optional.empty();
        }
    }

    private static OperationOutcome failedOutcome(OperationResult result) {
        return new OperationOutcome(result, d -> d.withError(result.message(), Instant.now()));
    }

    private boolean tryAcquire(String environmentId) {
        return inFlight.add(environmentId);
    }

    private void release(String environmentId) {
        inFlight.remove(environmentId);
    }

    private OperationResult busy(String environmentId, String operation) {
        log.info("{} {} rejected: another operation is in flight", operation, environmentId);
        if (metrics != null) {
            metrics.recordOperation(operation, "busy");
        }
        return OperationResult.busy(environmentId, operation);
    }

    private void publish(String eventType, String environmentId, String operation, String kind, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        if (kind != null) {
            payload.put("kind", kind);
        }
        if (message != null) {
            payload.put("message", message);
        }
        eventBus.publish(ConsoleEvent.of(eventType, environmentId, payload));
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "env-op-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
