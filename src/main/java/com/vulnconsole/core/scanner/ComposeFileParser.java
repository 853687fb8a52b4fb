package com.vulnconsole.core.scanner;

import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts services, published host ports and image references from a
 * docker-compose file.
 * <p>
 * Both port syntaxes are understood: short ({@code "8080:80"},
 * {@code "127.0.0.1:8080:80/tcp"}, {@code "8080-8081:80-81"}) and long
 * ({@code {target: 80, published: 8080}}). Ports that only name a container
 * port, or whose host side is an unresolved {@code ${VAR}}, publish nothing.
 */
@Component
public class ComposeFileParser {

    /** Keys that mark a top-level mapping as a service in the legacy (v1) layout. */
    private static final Set<String> LEGACY_SERVICE_KEYS = Set.of("image", "build", "ports");

    /**
     * Parses the composition file at {@code composeFile}.
     *
     * @throws CompositionParseException if the file cannot be read or parsed
     */
    public ComposeDefinition parse(Path composeFile) {
        String content;
        try {
            content = Files.readString(composeFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompositionParseException("Cannot read " + composeFile + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    /**
     * Parses composition file content.
     *
     * @throws CompositionParseException if the content is not a YAML mapping
     */
    public ComposeDefinition parse(String content) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (YAMLException e) {
            throw new CompositionParseException("Invalid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            return ComposeDefinition.empty();
        }
        if (!(root instanceof Map<?, ?> document)) {
            throw new CompositionParseException("Composition file is not a mapping");
        }

        Map<?, ?> services = servicesOf(document);
        var serviceNames = new ArrayList<String>();
        var publishedPorts = new LinkedHashMap<String, Integer>();
        var hostPorts = new ArrayList<Integer>();
        var images = new ArrayList<String>();

        for (var entry : services.entrySet()) {
            String name = String.valueOf(entry.getKey());
            serviceNames.add(name);
            if (!(entry.getValue() instanceof Map<?, ?> service)) {
                continue;
            }
            if (service.get("image") instanceof String image && !image.isBlank()) {
                String trimmed = image.trim();
                if (!images.contains(trimmed)) {
                    images.add(trimmed);
                }
            }
            if (service.get("ports") instanceof List<?> ports) {
                for (Object port : ports) {
                    Integer hostPort = hostPortOf(port);
                    if (hostPort == null) continue;
                    publishedPorts.putIfAbsent(name, hostPort);
                    if (!hostPorts.contains(hostPort)) {
                        hostPorts.add(hostPort);
                    }
                }
            }
        }
        return new ComposeDefinition(serviceNames, publishedPorts, hostPorts, images);
    }

    private static Map<?, ?> servicesOf(Map<?, ?> document) {
        Object services = document.get("services");
        if (services instanceof Map<?, ?> map) {
            return map;
        }
        if (services != null) {
            throw new CompositionParseException("'services' is not a mapping");
        }
        // Legacy layout: services sit at the top level
        var legacy = new LinkedHashMap<Object, Object>();
        for (var entry : document.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?> candidate
                    && candidate.keySet().stream().anyMatch(k -> LEGACY_SERVICE_KEYS.contains(String.valueOf(k)))) {
                legacy.put(entry.getKey(), candidate);
            }
        }
        return legacy;
    }

    /**
     * Returns the host side of one port declaration, or {@code null} when the
     * declaration publishes nothing on the host.
     */
    static Integer hostPortOf(Object declaration) {
        if (declaration instanceof Map<?, ?> longSyntax) {
            Object published = longSyntax.get("published");
            return published == null ? null : parsePort(String.valueOf(published));
        }
        if (!(declaration instanceof String shortSyntax)) {
            // A bare number is a container port only
            return null;
        }
        String mapping = shortSyntax.trim();
        int slash = mapping.indexOf('/');
        if (slash >= 0) {
            mapping = mapping.substring(0, slash);
        }
        if (mapping.startsWith("[")) {
            // IPv6 host address: "[::1]:8080:80"
            int close = mapping.indexOf("]:");
            if (close < 0) return null;
            mapping = mapping.substring(close + 2);
        }
        String[] parts = mapping.split(":");
        if (parts.length < 2) {
            return null;
        }
        return parsePort(parts[parts.length - 2]);
    }

    private static Integer parsePort(String value) {
        String candidate = value.trim();
        int dash = candidate.indexOf('-');
        if (dash > 0) {
            candidate = candidate.substring(0, dash);
        }
        try {
            int port = Integer.parseInt(candidate);
            return port > 0 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
