package com.vulnconsole.core.operations;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vulnconsole.core.model.EnvironmentDescriptor;

import java.util.List;

/**
 * Structured outcome of a start/stop/pull request, rendered directly by the HTTP
 * and CLI layers.
 *
 * @param environmentId the environment the operation targeted
 * @param operation     "start", "stop" or "pull"
 * @param kind          outcome classification
 * @param message       human-readable detail, nullable on success
 * @param conflicting   containers holding a requested host port (port conflicts only)
 * @param environment   descriptor after the cache patch, nullable when nothing was patched
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
    @JsonProperty("id") String environmentId,
    String operation,
    Kind kind,
    String message,
    List<String> conflicting,
    EnvironmentDescriptor environment
) {

    public enum Kind {
        SUCCESS,
        ACCEPTED,
        FAILURE,
        PORT_CONFLICT,
        BUSY,
        RUNTIME_UNAVAILABLE,
        NOT_FOUND
    }

    public OperationResult {
        conflicting = conflicting == null ? List.of() : List.copyOf(conflicting);
    }

    @JsonProperty("success")
    public boolean success() {
        return kind == Kind.SUCCESS || kind == Kind.ACCEPTED;
    }

    @JsonProperty("port_conflict")
    public boolean portConflict() {
        return kind == Kind.PORT_CONFLICT;
    }

    public OperationResult withEnvironment(EnvironmentDescriptor descriptor) {
        return new OperationResult(environmentId, operation, kind, message, conflicting, descriptor);
    }

    public static OperationResult success(String id, String operation) {
        return new OperationResult(id, operation, Kind.SUCCESS, null, List.of(), null);
    }

    public static OperationResult accepted(String id, String operation) {
        return new OperationResult(id, operation, Kind.ACCEPTED, operation + " started", List.of(), null);
    }

    public static OperationResult failure(String id, String operation, String message) {
        return new OperationResult(id, operation, Kind.FAILURE, message, List.of(), null);
    }

    public static OperationResult portConflict(String id, String message, List<String> conflicting) {
        return new OperationResult(id, "start", Kind.PORT_CONFLICT, message, conflicting, null);
    }

    public static OperationResult busy(String id, String operation) {
        return new OperationResult(id, operation, Kind.BUSY,
                "Another operation is already running for " + id, List.of(), null);
    }

    public static OperationResult runtimeUnavailable(String id, String operation, String message) {
        return new OperationResult(id, operation, Kind.RUNTIME_UNAVAILABLE, message, List.of(), null);
    }

    public static OperationResult notFound(String id, String operation) {
        return new OperationResult(id, operation, Kind.NOT_FOUND, "Environment not found: " + id, List.of(), null);
    }
}
