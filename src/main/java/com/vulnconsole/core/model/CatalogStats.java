package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate counters over the catalog.
 *
 * @param total       number of environments
 * @param running     environments with status {@code running}
 * @param stopped     environments with status {@code stopped}
 * @param unknown     environments never successfully probed
 * @param withExploit environments shipping exploit files
 * @param withImages  environments whose images are all present locally
 * @param categories  environment count per category, ordered by category
 */
public record CatalogStats(
    int total,
    int running,
    int stopped,
    int unknown,
    @JsonProperty("with_exploit") int withExploit,
    @JsonProperty("with_images") int withImages,
    Map<String, Integer> categories
) {}
