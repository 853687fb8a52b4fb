package com.vulnconsole.dispatch.api;

import com.vulnconsole.core.events.ConsoleEvent;
import com.vulnconsole.core.events.EventBus;
import com.vulnconsole.core.operations.OperationResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for pull progress.
 * <p>
 * Bus events are renamed for the stream: {@code pull.log} becomes {@code log},
 * {@code operation.completed} becomes {@code done} and {@code operation.failed}
 * becomes {@code error}. The emitter is completed after the terminal event.
 * A client that goes away only drops its subscription; the pull carries on.
 * <p>
 * Heartbeats are sent as SSE comments so proxies keep idle streams open while a
 * large layer downloads.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 60 minutes (large images on slow links). */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final String LOG_EVENT = "log";
    static final String DONE_EVENT = "done";
    static final String ERROR_EVENT = "error";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for {}: {}", registration.environmentId, e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter subscribed to the environment's events. Subscribe before
     * starting the operation so no event is missed.
     */
    public SseEmitter createEmitter(String environmentId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(environmentId, event -> forward(emitter, event));
        var registration = new EmitterRegistration(environmentId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", environmentId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", environmentId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for {} (timeout={}ms, {} environments streaming)",
                environmentId, timeoutMs, eventBus.subscribedEnvironmentCount());
        return emitter;
    }

    /**
     * Sends a terminal {@code error} frame for an operation that never started
     * (busy, unknown id) and completes the emitter.
     */
    public void rejectAndComplete(SseEmitter emitter, OperationResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", result.environmentId());
        data.put("kind", result.kind().name().toLowerCase());
        data.put("message", result.message());
        try {
            emitter.send(SseEmitter.event().name(ERROR_EVENT).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not send rejection for {}: {}", result.environmentId(), e.getMessage());
        }
        emitter.complete();
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    /** Stream event name for a bus event, or {@code null} when it is not forwarded. */
    static String streamEventName(String eventType) {
        return switch (eventType) {
            case ConsoleEvent.PULL_LOG -> LOG_EVENT;
            case ConsoleEvent.OPERATION_COMPLETED -> DONE_EVENT;
            case ConsoleEvent.OPERATION_FAILED -> ERROR_EVENT;
            default -> null;
        };
    }

    private void forward(SseEmitter emitter, ConsoleEvent event) {
        String name = streamEventName(event.eventType());
        if (name == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", event.environmentId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send {} for {}: {}", name, event.environmentId(), e.getMessage());
        }
        if (event.isTerminal()) {
            emitter.complete();
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String environmentId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
