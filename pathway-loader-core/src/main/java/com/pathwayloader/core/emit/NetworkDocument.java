package com.pathwayloader.core.emit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final network handed to styling and upload.
 *
 * <p>Mirrors the CX data model: integer-identified nodes and edges plus attribute
 * aspects that refer to them by id.
 *
 * @param nodes network nodes
 * @param edges network edges
 * @param nodeAttributes attributes attached to nodes
 * @param edgeAttributes attributes attached to edges
 * @param networkAttributes network level attributes (name, description, ...)
 */
public record NetworkDocument(
    List<Node> nodes,
    List<Edge> edges,
    List<Attribute> nodeAttributes,
    List<Attribute> edgeAttributes,
    List<NetworkAttribute> networkAttributes
) {
    public static final String LIST_OF_STRING = "list_of_string";

    /**
     * Compact constructor making defensive immutable copies.
     */
    public NetworkDocument {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        nodeAttributes = nodeAttributes == null ? List.of() : List.copyOf(nodeAttributes);
        edgeAttributes = edgeAttributes == null ? List.of() : List.copyOf(edgeAttributes);
        networkAttributes = networkAttributes == null ? List.of() : List.copyOf(networkAttributes);
    }

    /**
     * Looks up a network attribute by name.
     *
     * @param name attribute name
     * @return attribute value if present
     */
    public Optional<String> networkAttribute(String name) {
        return networkAttributes.stream()
            .filter(attribute -> attribute.name().equals(name))
            .map(NetworkAttribute::value)
            .findFirst();
    }

    /**
     * Looks up a node attribute.
     *
     * @param nodeId node id
     * @param name attribute name
     * @return attribute value if present
     */
    public Optional<Object> nodeAttribute(long nodeId, String name) {
        return nodeAttributes.stream()
            .filter(attribute -> attribute.propertyOf() == nodeId && attribute.name().equals(name))
            .map(Attribute::value)
            .findFirst();
    }

    /**
     * @param id node id
     * @param name display name
     * @param represents external identifier, may be null
     */
    public record Node(long id, String name, String represents) {
        public Node {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * @param id edge id
     * @param sourceId source node id
     * @param targetId target node id
     * @param interaction interaction label
     */
    public record Edge(long id, long sourceId, long targetId, String interaction) {
        public Edge {
            Objects.requireNonNull(interaction, "interaction must not be null");
        }
    }

    /**
     * @param propertyOf id of the node or edge the attribute belongs to
     * @param name attribute name
     * @param value a {@code String} or a {@code List<String>}
     * @param dataType CX data type, null for plain strings
     */
    public record Attribute(long propertyOf, String name, Object value, String dataType) {
        public Attribute {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public record NetworkAttribute(String name, String value) {
        public NetworkAttribute {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
