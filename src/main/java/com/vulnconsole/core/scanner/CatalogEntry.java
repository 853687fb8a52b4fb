package com.vulnconsole.core.scanner;

import java.nio.file.Path;

/**
 * An environment directory found by the cheap directory listing, before its
 * composition file is parsed.
 *
 * @param id               path relative to the catalog root, "/"-separated
 * @param category         first path segment
 * @param cve              last path segment
 * @param directory        absolute environment directory
 * @param composeFile      the recognised composition file inside {@code directory}
 * @param contentSignature size/mtime signature of {@code composeFile}
 */
public record CatalogEntry(
    String id,
    String category,
    String cve,
    Path directory,
    Path composeFile,
    String contentSignature
) {}
