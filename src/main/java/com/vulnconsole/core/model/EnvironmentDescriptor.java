package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last-known state of one environment directory in the catalog.
 * <p>
 * Instances are immutable; the reconciliation engine derives updated copies through
 * the {@code with*} methods and persists them through the cache store.
 *
 * @param id               path relative to the catalog root, e.g. {@code "nginx/CVE-2021-23017"}
 * @param category         first path segment
 * @param cve              last path segment; a CVE id or a descriptive name
 * @param services         service name to published host port; services without a known port are absent
 * @param serviceNames     every service declared by the composition file, in file order
 * @param images           image references declared by the composition file
 * @param hasExploit       at least one recognised exploit file exists
 * @param exploitFiles     recognised exploit files relative to the environment directory
 * @param hasImages        every image was present in the local image store at last check
 * @param status           last observed container state
 * @param contentSignature size/mtime signature of the composition file
 * @param parseError       the composition file could not be parsed
 * @param hasReadme        an English README exists
 * @param hasReadmeZh      a Chinese README exists
 * @param screenshots      first-level screenshot file names
 * @param lastChecked      when the entry was last scanned or patched
 * @param lastError        message of the last failed operation, nullable
 */
public record EnvironmentDescriptor(
    String id,
    String category,
    String cve,
    Map<String, Integer> services,
    @JsonProperty("service_names") List<String> serviceNames,
    List<String> images,
    @JsonProperty("has_exploit") boolean hasExploit,
    @JsonProperty("exploit_files") List<String> exploitFiles,
    @JsonProperty("has_images") boolean hasImages,
    EnvironmentStatus status,
    @JsonProperty("content_signature") String contentSignature,
    @JsonProperty("parse_error") boolean parseError,
    @JsonProperty("has_readme") boolean hasReadme,
    @JsonProperty("has_readme_zh") boolean hasReadmeZh,
    List<String> screenshots,
    @JsonProperty("last_checked") Instant lastChecked,
    @JsonProperty("last_error") String lastError
) implements Serializable {

    public EnvironmentDescriptor {
        services = services == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(services));
        serviceNames = serviceNames == null ? List.of() : List.copyOf(serviceNames);
        images = images == null ? List.of() : List.copyOf(images);
        exploitFiles = exploitFiles == null ? List.of() : List.copyOf(exploitFiles);
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        status = status == null ? EnvironmentStatus.UNKNOWN : status;
    }

    public EnvironmentDescriptor withStatus(EnvironmentStatus newStatus, Instant checkedAt) {
        return new EnvironmentDescriptor(id, category, cve, services, serviceNames, images,
                hasExploit, exploitFiles, hasImages, newStatus, contentSignature, parseError,
                hasReadme, hasReadmeZh, screenshots, checkedAt, null);
    }

    /**
     * Returns a copy whose published ports are the declared ones overridden by
     * the observed ones.
     */
    public EnvironmentDescriptor withObservedPorts(Map<String, Integer> observed) {
        if (observed == null || observed.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(services);
        merged.putAll(observed);
        var names = new ArrayList<>(serviceNames);
        for (String service : observed.keySet()) {
            if (!names.contains(service)) {
                names.add(service);
            }
        }
        return new EnvironmentDescriptor(id, category, cve, merged, names, images,
                hasExploit, exploitFiles, hasImages, status, contentSignature, parseError,
                hasReadme, hasReadmeZh, screenshots, lastChecked, lastError);
    }

    public EnvironmentDescriptor withImages(List<String> newImages, boolean present, Instant checkedAt) {
        return new EnvironmentDescriptor(id, category, cve, services, serviceNames, newImages,
                hasExploit, exploitFiles, present, status, contentSignature, parseError,
                hasReadme, hasReadmeZh, screenshots, checkedAt, lastError);
    }

    public EnvironmentDescriptor withImagesPresent(boolean present) {
        return withImages(images, present, lastChecked);
    }

    /** Records a failed operation without touching the observed state. */
    public EnvironmentDescriptor withError(String message, Instant checkedAt) {
        return new EnvironmentDescriptor(id, category, cve, services, serviceNames, images,
                hasExploit, exploitFiles, hasImages, status, contentSignature, parseError,
                hasReadme, hasReadmeZh, screenshots, checkedAt, message);
    }

    /**
     * Returns a copy with the observed state of {@code other} (status, published
     * ports, image presence and last error) over this descriptor's scanned content.
     */
    public EnvironmentDescriptor withRuntimeStateOf(EnvironmentDescriptor other) {
        var merged = new LinkedHashMap<>(services);
        merged.putAll(other.services());
        return new EnvironmentDescriptor(id, category, cve, merged, serviceNames, images,
                hasExploit, exploitFiles, other.hasImages(), other.status(), contentSignature, parseError,
                hasReadme, hasReadmeZh, screenshots, other.lastChecked(), other.lastError());
    }

    /** First published host port in service declaration order, or {@code null}. */
    public Integer primaryPort() {
        for (String name : serviceNames) {
            Integer port = services.get(name);
            if (port != null) {
                return port;
            }
        }
        return services.values().stream().findFirst().orElse(null);
    }
}
