package com.pathwayloader.core.pipeline.stage;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.pipeline.PipelineStatistics;
import com.pathwayloader.core.pipeline.StageResult;
import com.pathwayloader.core.pipeline.base.AbstractStage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses edges that connect the same nodes with the same interaction.
 *
 * <p>Directed interactions are grouped by {@code (source, target, type)}; interactions
 * listed as undirected are grouped by the unordered endpoint pair plus type. Labels
 * compare case-insensitively. The first edge of each group in input order is kept
 * unchanged.
 */
public class EdgeDeduplicationStage extends AbstractStage {

    public static final String STAGE_ID = "edge-deduplication";

    private final Set<String> undirectedTypes;

    /**
     * @param undirectedTypes interaction labels without direction, compared case-insensitively
     */
    public EdgeDeduplicationStage(Set<String> undirectedTypes) {
        this.undirectedTypes = undirectedTypes.stream()
            .map(AbstractStage::interactionKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String getId() {
        return STAGE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Edge Deduplicator";
    }

    @Override
    public StageResult apply(NetworkTables tables) {
        if (tables.edges().isEmpty()) {
            return unchanged(tables);
        }

        Set<EdgeKey> seen = new HashSet<>();
        List<EdgeRecord> unique = new ArrayList<>();
        for (EdgeRecord edge : tables.edges()) {
            if (seen.add(keyOf(edge))) {
                unique.add(edge);
            } else {
                log.debug("Duplicate edge {} -[{}]-> {}", edge.sourceId(), edge.interactionType(), edge.targetId());
            }
        }

        int removed = tables.edges().size() - unique.size();
        if (removed > 0) {
            log.info("Removed {} duplicate edges", removed);
        }
        return result(tables.withEdges(unique), List.of(), List.of(),
            Map.of(PipelineStatistics.DUPLICATE_EDGES_REMOVED, removed));
    }

    private EdgeKey keyOf(EdgeRecord edge) {
        String type = interactionKey(edge.interactionType());
        String source = edge.sourceId();
        String target = edge.targetId();
        if (undirectedTypes.contains(type) && source.compareTo(target) > 0) {
            return new EdgeKey(target, source, type);
        }
        return new EdgeKey(source, target, type);
    }

    private record EdgeKey(String first, String second, String type) {
    }
}
