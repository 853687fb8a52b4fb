package com.vulnconsole.runtime.docker;

/**
 * Canonical form of an image reference, so that {@code nginx},
 * {@code docker.io/library/nginx:latest} and {@code nginx:latest} compare equal.
 *
 * @param repository repository without registry defaults, e.g. {@code vulhub/php}
 * @param tag        tag, or {@code null} when the reference is pinned by digest
 * @param digest     {@code sha256:...} digest, or {@code null}
 */
public record ImageReference(String repository, String tag, String digest) {

    private static final String DEFAULT_TAG = "latest";

    public static ImageReference parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Image reference must not be blank");
        }
        String ref = reference.trim();
        String digest = null;
        int at = ref.indexOf('@');
        if (at >= 0) {
            digest = ref.substring(at + 1);
            ref = ref.substring(0, at);
        }

        String tag = null;
        int lastSlash = ref.lastIndexOf('/');
        int colon = ref.lastIndexOf(':');
        // A colon before the last slash belongs to a registry host:port
        if (colon > lastSlash) {
            tag = ref.substring(colon + 1);
            ref = ref.substring(0, colon);
        }
        if (tag == null && digest == null) {
            tag = DEFAULT_TAG;
        }
        return new ImageReference(stripDefaultRegistry(ref), tag, digest);
    }

    /** Canonical string used for presence comparisons. */
    public String canonical() {
        return digest != null ? repository + "@" + digest : repository + ":" + tag;
    }

    /** The value passed as the tag parameter of a pull: the tag or the digest. */
    public String pullTag() {
        return digest != null ? digest : tag;
    }

    @Override
    public String toString() {
        return canonical();
    }

    private static String stripDefaultRegistry(String repository) {
        String repo = repository;
        for (String prefix : new String[]{"docker.io/", "index.docker.io/", "registry-1.docker.io/"}) {
            if (repo.startsWith(prefix)) {
                repo = repo.substring(prefix.length());
                break;
            }
        }
        if (repo.startsWith("library/")) {
            repo = repo.substring("library/".length());
        }
        return repo;
    }
}
