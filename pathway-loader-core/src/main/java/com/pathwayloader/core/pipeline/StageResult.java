package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.NetworkTables;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result returned by a pipeline stage.
 *
 * @param stageId ID of the stage that produced this result
 * @param tables transformed tables
 * @param findings advisory findings (invalid names, nested complexes, cycles)
 * @param warnings non-fatal input defects the stage repaired, e.g. dropped references
 * @param counters named counts for {@link PipelineStatistics}
 */
public record StageResult(
    String stageId,
    NetworkTables tables,
    List<Finding> findings,
    List<String> warnings,
    Map<String, Integer> counters
) {
    /**
     * Compact constructor with validation.
     */
    public StageResult {
        Objects.requireNonNull(stageId, "stageId must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    /**
     * Returns a counter value.
     *
     * @param name counter name
     * @return value, 0 if the stage did not report it
     */
    public int counter(String name) {
        return counters.getOrDefault(name, 0);
    }
}
