package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of waiting for an environment's first published port to accept connections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReadinessResult(
    String id,
    boolean ready,
    Integer port,
    @JsonProperty("waited_ms") long waitedMs,
    String message
) {}
