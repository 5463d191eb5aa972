package com.pathwayloader.core.output;

import java.util.Objects;

/**
 * A file to be written by an {@link OutputWriter}.
 *
 * @param relativePath path relative to the output directory (e.g. "networks/wnt.cx")
 * @param content file content
 * @param contentType content type, e.g. "application/json"
 */
public record OutputFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String CX_CONTENT_TYPE = "application/json";
    public static final String TSV_CONTENT_TYPE = "text/tab-separated-values";

    /**
     * Compact constructor with validation.
     */
    public OutputFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
