package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.emit.NetworkDocument;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.model.NetworkDescription;
import com.pathwayloader.core.model.NetworkTables;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of normalizing one network.
 *
 * @param sourceName file the network came from
 * @param description header metadata
 * @param tables assembled tables
 * @param document emitted network
 * @param findings findings of all stages, in stage order
 * @param warnings repaired input defects of all stages, in stage order
 * @param statistics counts collected along the way
 */
public record NormalizationResult(
    String sourceName,
    NetworkDescription description,
    NetworkTables tables,
    NetworkDocument document,
    List<Finding> findings,
    List<String> warnings,
    PipelineStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public NormalizationResult {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        Objects.requireNonNull(document, "document must not be null");
        if (description == null) {
            description = NetworkDescription.empty();
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (statistics == null) {
            statistics = PipelineStatistics.empty();
        }
    }

    public List<Finding> findingsOfType(FindingType type) {
        return findings.stream().filter(finding -> finding.type() == type).toList();
    }
}
