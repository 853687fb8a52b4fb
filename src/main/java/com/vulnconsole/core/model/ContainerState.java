package com.vulnconsole.core.model;

import java.util.Map;

/**
 * Observed runtime state of one environment's containers.
 *
 * @param status   {@code RUNNING} if any container of the environment is up
 * @param services service name to published host port, as reported by the runtime
 */
public record ContainerState(
    EnvironmentStatus status,
    Map<String, Integer> services
) {
    public ContainerState {
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public static ContainerState stopped() {
        return new ContainerState(EnvironmentStatus.STOPPED, Map.of());
    }
}
