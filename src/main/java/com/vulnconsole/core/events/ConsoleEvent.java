package com.vulnconsole.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an operation runs against one environment, used for SSE
 * streaming and the CLI progress output.
 *
 * @param eventType     event type, see the constants below
 * @param environmentId the environment this event belongs to
 * @param payload       event data; progress lines are under {@code "line"}
 * @param timestamp     when the event occurred
 */
public record ConsoleEvent(
    String eventType,
    String environmentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String OPERATION_STARTED = "operation.started";
    public static final String OPERATION_COMPLETED = "operation.completed";
    public static final String OPERATION_FAILED = "operation.failed";
    public static final String PULL_LOG = "pull.log";

    public ConsoleEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static ConsoleEvent of(String eventType, String environmentId, Map<String, Object> payload) {
        return new ConsoleEvent(eventType, environmentId, payload, Instant.now());
    }

    /** True for the markers that end an operation's event sequence. */
    public boolean isTerminal() {
        return OPERATION_COMPLETED.equals(eventType) || OPERATION_FAILED.equals(eventType);
    }
}
