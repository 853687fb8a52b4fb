package com.vulnconsole.runtime;

/**
 * Thrown when the container runtime cannot be reached or the compose CLI is missing.
 */
public class RuntimeUnavailableException extends RuntimeException {
    public RuntimeUnavailableException(String message) {
        super(message);
    }

    public RuntimeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
