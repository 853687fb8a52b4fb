package com.vulnconsole.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Images an environment declares and the subset absent from the local image store.
 *
 * @param success            {@code false} when the composition file could not be read
 *                           or the runtime could not be asked
 * @param message            failure detail, null on success
 * @param runtimeUnavailable the failure came from the container runtime, not the file
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MissingImages(
    String id,
    List<String> images,
    List<String> missing,
    boolean success,
    String message,
    @JsonIgnore boolean runtimeUnavailable
) {
    public MissingImages {
        images = images == null ? List.of() : List.copyOf(images);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static MissingImages of(String id, List<String> images, List<String> missing) {
        return new MissingImages(id, images, missing, true, null, false);
    }

    public static MissingImages unparseable(String id, String message) {
        return new MissingImages(id, List.of(), List.of(), false, message, false);
    }

    public static MissingImages unavailable(String id, List<String> images, String message) {
        return new MissingImages(id, images, List.of(), false, message, true);
    }
}
