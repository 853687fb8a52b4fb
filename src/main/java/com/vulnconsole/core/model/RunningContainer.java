package com.vulnconsole.core.model;

/**
 * A container currently running on the host, regardless of which environment owns it.
 *
 * @param id     short container id
 * @param name   container name without the leading slash
 * @param image  image the container was created from
 * @param status runtime status text, e.g. "Up 5 minutes"
 * @param ports  published ports rendered as {@code host->container/proto}
 */
public record RunningContainer(
    String id,
    String name,
    String image,
    String status,
    String ports
) {}
