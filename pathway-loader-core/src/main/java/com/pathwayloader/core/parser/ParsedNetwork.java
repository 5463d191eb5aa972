package com.pathwayloader.core.parser;

import com.pathwayloader.core.model.NetworkDescription;
import com.pathwayloader.core.model.NetworkTables;

import java.util.Objects;

/**
 * Output of {@link NetworkFileParser}: the header metadata plus raw node and edge tables.
 *
 * @param sourceName file name the network was read from
 * @param description title and description from the file header
 * @param tables parsed node and edge tables, no memberships yet
 */
public record ParsedNetwork(
    String sourceName,
    NetworkDescription description,
    NetworkTables tables
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedNetwork {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        if (description == null) {
            description = NetworkDescription.empty();
        }
    }
}
