package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A descriptor together with the raw text of its composition file.
 *
 * @param compose composition file text, null when it could not be read
 */
public record EnvironmentDetail(
    @JsonUnwrapped EnvironmentDescriptor environment,
    String compose
) {}
