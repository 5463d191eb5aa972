package com.pathwayloader.core.output;

/**
 * Port through which emitted networks and finding reports leave the loader.
 *
 * <p>Implementations write to a destination such as the filesystem or the console.
 * Publication to a remote network repository is a separate collaborator that consumes
 * the files written here.
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer (e.g., "filesystem", "console").
     *
     * @return writer identifier
     */
    String getId();

    /**
     * Writes all files of the output.
     *
     * @param output files to write
     * @param context destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void write(NetworkOutput output, OutputContext context);
}
