package com.pathwayloader.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The table triple every pipeline stage consumes and produces.
 *
 * <p>Nodes form the arena keyed by {@link NodeRecord#id()}; edges and membership
 * relations refer to nodes only by identifier.
 *
 * @param nodes node table in input order
 * @param edges edge table in input order
 * @param memberships membership relations, empty until derived by the nesting resolver
 */
public record NetworkTables(
    List<NodeRecord> nodes,
    List<EdgeRecord> edges,
    List<MembershipRelation> memberships
) {
    /**
     * Compact constructor making defensive immutable copies.
     */
    public NetworkTables {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        memberships = memberships == null ? List.of() : List.copyOf(memberships);
    }

    public static NetworkTables empty() {
        return new NetworkTables(List.of(), List.of(), List.of());
    }

    /**
     * Indexes the node table by identifier, preserving table order.
     *
     * @return map of node id to node
     */
    public Map<String, NodeRecord> nodesById() {
        Map<String, NodeRecord> index = new LinkedHashMap<>();
        for (NodeRecord node : nodes) {
            index.put(node.id(), node);
        }
        return index;
    }

    public NetworkTables withEdges(List<EdgeRecord> newEdges) {
        Objects.requireNonNull(newEdges, "newEdges must not be null");
        return new NetworkTables(nodes, newEdges, memberships);
    }
}
