package com.pathwayloader.core.pipeline;

/**
 * Statistics collected while normalizing one network.
 *
 * @param nodesParsed node rows read from the file
 * @param edgesParsed edge rows read from the file
 * @param membershipEdgesConsumed edges converted into membership relations
 * @param membershipRelations flattened complex-to-leaf relations after assembly
 * @param duplicateEdgesRemoved edges collapsed by deduplication
 * @param danglingEdgesDropped edges whose endpoints were not in the node table
 * @param orphanGenesPruned gene nodes removed for having no incident edge or membership
 * @param compartmentsRemoved compartment nodes folded into node attributes
 * @param nodesEmitted nodes in the final network
 * @param edgesEmitted edges in the final network
 */
public record PipelineStatistics(
    int nodesParsed,
    int edgesParsed,
    int membershipEdgesConsumed,
    int membershipRelations,
    int duplicateEdgesRemoved,
    int danglingEdgesDropped,
    int orphanGenesPruned,
    int compartmentsRemoved,
    int nodesEmitted,
    int edgesEmitted
) {
    public static final String MEMBERSHIP_EDGES_CONSUMED = "membershipEdgesConsumed";
    public static final String DUPLICATE_EDGES_REMOVED = "duplicateEdgesRemoved";
    public static final String DANGLING_EDGES_DROPPED = "danglingEdgesDropped";
    public static final String ORPHAN_GENES_PRUNED = "orphanGenesPruned";
    public static final String COMPARTMENTS_REMOVED = "compartmentsRemoved";

    /**
     * Creates an empty statistics instance.
     *
     * @return statistics with every count zero
     */
    public static PipelineStatistics empty() {
        return new PipelineStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Returns true if the pipeline removed or rewrote anything.
     *
     * @return true if any edge or node was dropped or collapsed
     */
    public boolean hasChanges() {
        return membershipEdgesConsumed > 0
            || duplicateEdgesRemoved > 0
            || danglingEdgesDropped > 0
            || orphanGenesPruned > 0
            || compartmentsRemoved > 0;
    }
}
