package com.vulnconsole.core.model;

/**
 * Content of one recognised exploit script.
 *
 * @param filename file name without directories
 * @param path     path relative to the environment directory
 * @param content  file text, truncated to {@link #MAX_CONTENT_CHARS}
 * @param size     length of the full text in characters
 * @param lines    number of lines in the full text
 * @param usage    first line mentioning {@code usage:} or {@code example:} near the top, or empty
 */
public record ExploitFile(
    String filename,
    String path,
    String content,
    int size,
    int lines,
    String usage
) {
    public static final int MAX_CONTENT_CHARS = 10_000;
}
