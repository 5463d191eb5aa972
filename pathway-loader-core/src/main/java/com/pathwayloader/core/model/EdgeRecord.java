package com.pathwayloader.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An edge row of a network file.
 *
 * @param edgeId identifier from the file, may be null
 * @param sourceId source node identifier
 * @param targetId target node identifier
 * @param interactionType interaction label (e.g. ACTIVATES, BINDS)
 * @param attributes extra columns in file order, keyed by column name
 */
public record EdgeRecord(
    String edgeId,
    String sourceId,
    String targetId,
    String interactionType,
    Map<String, String> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public EdgeRecord {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(interactionType, "interactionType must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates an edge without identifier or extra attributes.
     *
     * @param sourceId source node identifier
     * @param targetId target node identifier
     * @param interactionType interaction label
     * @return new edge
     */
    public static EdgeRecord of(String sourceId, String targetId, String interactionType) {
        return new EdgeRecord(null, sourceId, targetId, interactionType, Map.of());
    }
}
