package com.pathwayloader.core.pipeline.stage;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.model.MembershipRelation;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;
import com.pathwayloader.core.model.NodeType;
import com.pathwayloader.core.pipeline.PipelineStatistics;
import com.pathwayloader.core.pipeline.StageResult;
import com.pathwayloader.core.pipeline.base.AbstractStage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives complex membership and flattens it to exactly one level.
 *
 * <p>Membership comes from two places: a node's {@code PARENT_ID} when the parent is
 * complex-typed, and edges whose interaction label is a membership label (the source
 * is the member, the target the complex). Membership edges are consumed here and do
 * not reach later stages.
 *
 * <p>Every complex node then has nested complex members replaced by their own members
 * until only non-complex members remain. Each nested complex reached from a complex
 * yields a {@link FindingType#NESTED_COMPLEX} finding. A nested complex shared by several
 * complexes is expanded once per root. A loop stops expansion of that branch and yields a
 * {@link FindingType#MEMBERSHIP_CYCLE} finding.
 *
 * <p>The output is a fixed point: applying the stage again yields the same member sets.
 */
public class NestingResolutionStage extends AbstractStage {

    public static final String STAGE_ID = "nesting-resolution";

    private final Set<String> membershipTypes;

    /**
     * @param membershipTypes interaction labels that encode membership, compared case-insensitively
     */
    public NestingResolutionStage(Set<String> membershipTypes) {
        this.membershipTypes = membershipTypes.stream()
            .map(AbstractStage::interactionKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String getId() {
        return STAGE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Complex Nesting Resolver";
    }

    @Override
    public StageResult apply(NetworkTables tables) {
        Map<String, NodeRecord> nodes = tables.nodesById();
        List<String> warnings = new ArrayList<>();

        Set<MembershipRelation> direct = new LinkedHashSet<>(tables.memberships());
        for (NodeRecord node : tables.nodes()) {
            if (node.parentId() == null) {
                continue;
            }
            NodeRecord parent = nodes.get(node.parentId());
            if (parent == null) {
                warnings.add("Node " + node.id() + " references unknown parent " + node.parentId());
            } else if (parent.isComplex()) {
                direct.add(new MembershipRelation(parent.id(), node.id()));
            } else if (parent.type() != NodeType.COMPARTMENT) {
                warnings.add("Node " + node.id() + " references parent " + parent.id()
                    + " of type " + parent.type().label() + ", which cannot hold members");
            }
        }

        List<EdgeRecord> remainingEdges = new ArrayList<>();
        int consumed = 0;
        for (EdgeRecord edge : tables.edges()) {
            if (!membershipTypes.contains(interactionKey(edge.interactionType()))) {
                remainingEdges.add(edge);
                continue;
            }
            consumed++;
            NodeRecord member = nodes.get(edge.sourceId());
            NodeRecord complex = nodes.get(edge.targetId());
            if (member == null || complex == null || !complex.isComplex()) {
                warnings.add("Dropped membership edge " + edge.sourceId() + " -> " + edge.targetId()
                    + ": target must be an existing complex node");
            } else {
                direct.add(new MembershipRelation(complex.id(), member.id()));
            }
        }

        MembershipGraph graph = new MembershipGraph(direct);
        List<Finding> findings = new ArrayList<>();
        List<MembershipRelation> flattened = new ArrayList<>();
        for (NodeRecord node : tables.nodes()) {
            if (!node.isComplex()) {
                continue;
            }
            List<String> path = new ArrayList<>();
            path.add(node.id());
            Set<String> leaves = new LinkedHashSet<>();
            Set<String> reported = new LinkedHashSet<>();
            expand(node, node.id(), path, graph, nodes, leaves, reported, findings);
            leaves.forEach(leaf -> flattened.add(new MembershipRelation(node.id(), leaf)));
        }

        warnings.forEach(warning -> log.warn(warning));
        if (!findings.isEmpty()) {
            log.info("Flattened nested complexes: {} findings", findings.size());
        }

        NetworkTables resolved = new NetworkTables(tables.nodes(), remainingEdges, flattened);
        return result(resolved, findings, warnings,
            Map.of(PipelineStatistics.MEMBERSHIP_EDGES_CONSUMED, consumed));
    }

    private void expand(
            NodeRecord root,
            String current,
            List<String> path,
            MembershipGraph graph,
            Map<String, NodeRecord> nodes,
            Set<String> leaves,
            Set<String> reported,
            List<Finding> findings) {
        for (String memberId : graph.membersOf(current)) {
            NodeRecord member = nodes.get(memberId);
            if (member == null || !member.isComplex()) {
                leaves.add(memberId);
                continue;
            }
            if (path.contains(memberId)) {
                findings.add(new Finding(FindingType.MEMBERSHIP_CYCLE, root.id(), root.name(),
                    "membership cycle " + String.join(" -> ", path) + " -> " + memberId));
                continue;
            }
            // already expanded for this root, its leaves are collected
            if (!reported.add(memberId)) {
                continue;
            }
            findings.add(new Finding(FindingType.NESTED_COMPLEX, root.id(), root.name(),
                "contains complex " + member.name() + " (" + member.id() + ")"));
            path.add(memberId);
            expand(root, memberId, path, graph, nodes, leaves, reported, findings);
            path.remove(path.size() - 1);
        }
    }
}
