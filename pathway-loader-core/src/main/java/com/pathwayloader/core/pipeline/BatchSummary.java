package com.pathwayloader.core.pipeline;

import java.util.List;

/**
 * Outcome of a batch run, one entry per input file in processing order.
 *
 * @param results per-file results
 */
public record BatchSummary(
    List<NetworkLoadResult> results
) {
    /**
     * Compact constructor making a defensive immutable copy.
     */
    public BatchSummary {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public List<NormalizationResult> succeeded() {
        return results.stream()
            .filter(NetworkLoadResult::success)
            .map(NetworkLoadResult::result)
            .toList();
    }

    public List<NetworkLoadResult> failed() {
        return results.stream().filter(result -> !result.success()).toList();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(result -> !result.success());
    }
}
