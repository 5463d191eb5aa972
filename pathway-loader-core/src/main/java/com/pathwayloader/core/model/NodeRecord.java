package com.pathwayloader.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node row of a network file.
 *
 * @param id identifier, unique within one network
 * @param name display name (gene symbol for gene nodes)
 * @param type type tag
 * @param parentId identifier of the containing node, or null when top level
 * @param attributes extra columns in file order, keyed by column name
 */
public record NodeRecord(
    String id,
    String name,
    NodeType type,
    String parentId,
    Map<String, String> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public NodeRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (name == null) {
            name = "";
        }
        if (parentId != null && parentId.isBlank()) {
            parentId = null;
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a top-level node without extra attributes.
     *
     * @param id node identifier
     * @param name display name
     * @param type type tag
     * @return new node
     */
    public static NodeRecord of(String id, String name, NodeType type) {
        return new NodeRecord(id, name, type, null, Map.of());
    }

    /**
     * Returns a copy of this node with one attribute added or replaced.
     *
     * @param key attribute name
     * @param value attribute value
     * @return new node
     */
    public NodeRecord withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new NodeRecord(id, name, type, parentId, copy);
    }

    public boolean isGene() {
        return type == NodeType.GENE;
    }

    public boolean isComplex() {
        return type.isComplex();
    }
}
