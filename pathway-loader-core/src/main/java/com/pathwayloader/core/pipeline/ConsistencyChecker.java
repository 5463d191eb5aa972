package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.MembershipRelation;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Verifies the invariants of assembled tables before emission.
 */
public class ConsistencyChecker {

    /**
     * Checks referential closure, flattening, edge uniqueness and absence of orphan genes.
     *
     * @param networkName network name for the error message
     * @param tables assembled tables
     * @throws NetworkConsistencyException on the first violation found
     */
    public void check(String networkName, NetworkTables tables) {
        Map<String, NodeRecord> nodes = tables.nodesById();
        if (nodes.size() != tables.nodes().size()) {
            fail(networkName, "duplicate node identifiers in assembled table");
        }

        Set<String> incident = new HashSet<>();
        Set<String> triples = new HashSet<>();
        for (EdgeRecord edge : tables.edges()) {
            if (!nodes.containsKey(edge.sourceId()) || !nodes.containsKey(edge.targetId())) {
                fail(networkName, "edge " + edge.sourceId() + " -> " + edge.targetId() + " references a missing node");
            }
            String triple = edge.sourceId() + '\t' + edge.targetId() + '\t'
                + edge.interactionType().trim().toUpperCase(Locale.ROOT);
            if (!triples.add(triple)) {
                fail(networkName, "duplicate edge " + triple.replace('\t', ' '));
            }
            incident.add(edge.sourceId());
            incident.add(edge.targetId());
        }

        for (MembershipRelation relation : tables.memberships()) {
            NodeRecord complex = nodes.get(relation.complexId());
            NodeRecord member = nodes.get(relation.memberId());
            if (complex == null || member == null) {
                fail(networkName, "membership " + relation.complexId() + " -> " + relation.memberId()
                    + " references a missing node");
            }
            if (!complex.isComplex()) {
                fail(networkName, "node " + complex.id() + " has members but is not a complex");
            }
            if (member.isComplex()) {
                fail(networkName, "complex " + complex.id() + " still contains complex " + member.id());
            }
            incident.add(member.id());
        }

        for (NodeRecord node : tables.nodes()) {
            if (node.isGene() && !incident.contains(node.id())) {
                fail(networkName, "orphan gene " + node.id() + " survived assembly");
            }
        }
    }

    private static void fail(String networkName, String message) {
        throw new NetworkConsistencyException(networkName + ": " + message);
    }
}
