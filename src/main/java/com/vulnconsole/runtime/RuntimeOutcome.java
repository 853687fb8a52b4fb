package com.vulnconsole.runtime;

import java.util.List;

/**
 * Result of a compose up/down against the container runtime.
 *
 * @param success      the runtime reported success
 * @param portConflict the failure was caused by a host port already in use
 * @param conflicting  names of containers holding the requested ports, possibly empty
 * @param message      runtime error text, nullable on success
 */
public record RuntimeOutcome(
    boolean success,
    boolean portConflict,
    List<String> conflicting,
    String message
) {
    public RuntimeOutcome {
        conflicting = conflicting == null ? List.of() : List.copyOf(conflicting);
    }

    public static RuntimeOutcome ok() {
        return new RuntimeOutcome(true, false, List.of(), null);
    }

    public static RuntimeOutcome failed(String message) {
        return new RuntimeOutcome(false, false, List.of(), message);
    }

    public static RuntimeOutcome conflict(String message, List<String> conflicting) {
        return new RuntimeOutcome(false, true, conflicting, message);
    }
}
