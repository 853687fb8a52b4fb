package com.vulnconsole.core.scanner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of a composition file the catalog cares about. Every other key of
 * the file is dropped by {@link ComposeFileParser}.
 *
 * @param serviceNames   declared services in file order
 * @param publishedPorts first published host port per service
 * @param hostPorts      every host port any service asks for, in file order
 * @param images         image references in file order, without duplicates
 */
public record ComposeDefinition(
    List<String> serviceNames,
    Map<String, Integer> publishedPorts,
    List<Integer> hostPorts,
    List<String> images
) {
    public ComposeDefinition {
        serviceNames = serviceNames == null ? List.of() : List.copyOf(serviceNames);
        publishedPorts = publishedPorts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(publishedPorts));
        hostPorts = hostPorts == null ? List.of() : List.copyOf(hostPorts);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static ComposeDefinition empty() {
        return new ComposeDefinition(List.of(), Map.of(), List.of(), List.of());
    }
}
