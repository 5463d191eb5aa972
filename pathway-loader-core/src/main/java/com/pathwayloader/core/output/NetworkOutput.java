package com.pathwayloader.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Collection of files produced by one batch run.
 *
 * @param files files in write order
 */
public record NetworkOutput(
    List<OutputFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public NetworkOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
