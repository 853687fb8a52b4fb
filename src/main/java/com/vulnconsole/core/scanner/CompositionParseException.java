package com.vulnconsole.core.scanner;

/**
 * Thrown when a composition file is not valid YAML or does not have the shape of
 * a compose project.
 */
public class CompositionParseException extends RuntimeException {
    public CompositionParseException(String message) {
        super(message);
    }

    public CompositionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
