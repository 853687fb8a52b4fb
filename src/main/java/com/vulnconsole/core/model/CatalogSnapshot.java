package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Persisted content of the catalog cache file.
 * <p>
 * {@code format_version} is always serialised first so a reader can reject an
 * incompatible file before parsing the rest.
 *
 * @param formatVersion      cache layout version; a mismatch invalidates the whole file
 * @param catalogFingerprint combined hash over every environment id and its content signature
 * @param generatedAt        when the snapshot was produced by a full rescan
 * @param catalogRoot        absolute catalog root the snapshot was built from
 * @param environments       descriptors keyed by id, ordered by id
 */
@JsonPropertyOrder({"format_version", "catalog_fingerprint", "generated_at", "catalog_root", "environments"})
public record CatalogSnapshot(
    @JsonProperty("format_version") int formatVersion,
    @JsonProperty("catalog_fingerprint") String catalogFingerprint,
    @JsonProperty("generated_at") Instant generatedAt,
    @JsonProperty("catalog_root") String catalogRoot,
    Map<String, EnvironmentDescriptor> environments
) implements Serializable {

    /** Bumped whenever the descriptor layout changes incompatibly. */
    public static final int CURRENT_FORMAT_VERSION = 3;

    public CatalogSnapshot {
        environments = environments == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(environments));
    }

    public static CatalogSnapshot of(String fingerprint, Instant generatedAt, String catalogRoot,
                                     Collection<EnvironmentDescriptor> descriptors) {
        var byId = new TreeMap<String, EnvironmentDescriptor>();
        for (EnvironmentDescriptor descriptor : descriptors) {
            byId.put(descriptor.id(), descriptor);
        }
        return new CatalogSnapshot(CURRENT_FORMAT_VERSION, fingerprint, generatedAt, catalogRoot, byId);
    }

    /** Descriptors ordered by id. */
    public List<EnvironmentDescriptor> orderedEnvironments() {
        return List.copyOf(environments.values());
    }

    public Optional<EnvironmentDescriptor> find(String id) {
        return Optional.ofNullable(environments.get(id));
    }

    /**
     * Returns a copy with one descriptor replaced. Fingerprint and generation
     * time are kept: a point update never changes the set of ids.
     */
    public CatalogSnapshot replacing(String id, UnaryOperator<EnvironmentDescriptor> mutator) {
        EnvironmentDescriptor current = environments.get(id);
        if (current == null) {
            return this;
        }
        EnvironmentDescriptor updated = mutator.apply(current);
        if (updated == null || !id.equals(updated.id())) {
            throw new IllegalArgumentException("Patch for " + id + " must return a descriptor with the same id");
        }
        var copy = new TreeMap<>(environments);
        copy.put(id, updated);
        return new CatalogSnapshot(formatVersion, catalogFingerprint, generatedAt, catalogRoot, copy);
    }

    public List<String> allImages() {
        var images = new LinkedHashSet<String>();
        for (EnvironmentDescriptor descriptor : environments.values()) {
            images.addAll(descriptor.images());
        }
        return new ArrayList<>(images);
    }
}
