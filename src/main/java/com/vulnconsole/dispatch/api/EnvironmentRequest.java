package com.vulnconsole.dispatch.api;

/**
 * Request body for start and stop.
 *
 * @param id environment id, {@code <category>/<environment>}
 */
public record EnvironmentRequest(String id) {}
