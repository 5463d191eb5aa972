package com.pathwayloader.core.pipeline.stage;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.MembershipRelation;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;
import com.pathwayloader.core.model.NodeType;
import com.pathwayloader.core.pipeline.PipelineStatistics;
import com.pathwayloader.core.pipeline.StageResult;
import com.pathwayloader.core.pipeline.base.AbstractStage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the validated, flattened and deduplicated tables into one consistent pair.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Fold compartments: a node whose parent is a compartment gets a
 *       {@value #COMPARTMENT_ATTRIBUTE} attribute; compartment nodes are removed.</li>
 *   <li>Drop edges whose endpoints are not in the node table.</li>
 *   <li>Prune orphan genes: gene nodes that are neither an edge endpoint nor a
 *       member of a complex. Complex and other non-gene nodes are never pruned.</li>
 *   <li>Regenerate membership from the flattened relations, keeping only relations whose
 *       complex and member both survived. Must run after pruning.</li>
 * </ol>
 */
public class GraphAssemblyStage extends AbstractStage {

    public static final String STAGE_ID = "graph-assembly";
    public static final String COMPARTMENT_ATTRIBUTE = "compartment";

    @Override
    public String getId() {
        return STAGE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Graph Assembler";
    }

    @Override
    public StageResult apply(NetworkTables tables) {
        List<String> warnings = new ArrayList<>();
        Map<String, NodeRecord> index = tables.nodesById();

        // compartments
        List<NodeRecord> nodes = new ArrayList<>();
        int compartments = 0;
        for (NodeRecord node : tables.nodes()) {
            if (node.type() == NodeType.COMPARTMENT) {
                compartments++;
                continue;
            }
            NodeRecord parent = node.parentId() == null ? null : index.get(node.parentId());
            if (parent != null && parent.type() == NodeType.COMPARTMENT) {
                node = node.withAttribute(COMPARTMENT_ATTRIBUTE, parent.name());
            }
            nodes.add(node);
        }

        // dangling edges
        Set<String> nodeIds = new HashSet<>();
        nodes.forEach(node -> nodeIds.add(node.id()));
        List<EdgeRecord> edges = new ArrayList<>();
        for (EdgeRecord edge : tables.edges()) {
            if (nodeIds.contains(edge.sourceId()) && nodeIds.contains(edge.targetId())) {
                edges.add(edge);
            } else {
                warnings.add("Dropped edge " + edge.sourceId() + " -[" + edge.interactionType() + "]-> "
                    + edge.targetId() + ": endpoint not in node table");
            }
        }

        // orphan genes
        Set<String> incident = new HashSet<>();
        for (EdgeRecord edge : edges) {
            incident.add(edge.sourceId());
            incident.add(edge.targetId());
        }
        for (MembershipRelation relation : tables.memberships()) {
            if (nodeIds.contains(relation.complexId())) {
                incident.add(relation.memberId());
            }
        }
        List<NodeRecord> survivors = new ArrayList<>();
        int orphans = 0;
        for (NodeRecord node : nodes) {
            if (node.isGene() && !incident.contains(node.id())) {
                log.debug("Pruning orphan gene {} ({})", node.name(), node.id());
                orphans++;
            } else {
                survivors.add(node);
            }
        }

        // membership regeneration
        Set<String> survivorIds = new HashSet<>();
        survivors.forEach(node -> survivorIds.add(node.id()));
        List<MembershipRelation> memberships = new ArrayList<>();
        for (MembershipRelation relation : tables.memberships()) {
            if (survivorIds.contains(relation.complexId()) && survivorIds.contains(relation.memberId())) {
                memberships.add(relation);
            }
        }

        warnings.forEach(warning -> log.warn(warning));
        log.debug("Assembled {} nodes, {} edges, {} memberships ({} orphan genes pruned)",
            survivors.size(), edges.size(), memberships.size(), orphans);

        return result(new NetworkTables(survivors, edges, memberships), List.of(), warnings, Map.of(
            PipelineStatistics.COMPARTMENTS_REMOVED, compartments,
            PipelineStatistics.DANGLING_EDGES_DROPPED, tables.edges().size() - edges.size(),
            PipelineStatistics.ORPHAN_GENES_PRUNED, orphans));
    }
}
