package com.vulnconsole.core.operations;

import com.vulnconsole.core.model.EnvironmentDescriptor;

import java.util.function.UnaryOperator;

/**
 * What a coordinated operation produced: the result for the caller and the single
 * cache patch describing the state observed afterwards.
 *
 * @param result the caller-facing result
 * @param patch  applied to the environment's cache entry once the operation is over
 */
public record OperationOutcome(
    OperationResult result,
    UnaryOperator<EnvironmentDescriptor> patch
) {}
