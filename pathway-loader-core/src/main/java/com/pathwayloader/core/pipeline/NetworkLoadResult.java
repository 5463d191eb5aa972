package com.pathwayloader.core.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-file outcome of a batch run.
 *
 * @param sourceName file name
 * @param success whether the network was normalized
 * @param result normalization result, null on failure
 * @param error failure message, null on success
 */
public record NetworkLoadResult(
    String sourceName,
    boolean success,
    NormalizationResult result,
    String error
) {
    /**
     * Compact constructor with validation.
     */
    public NetworkLoadResult {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        if (success) {
            Objects.requireNonNull(result, "result must not be null for a successful load");
        }
    }

    public static NetworkLoadResult succeeded(NormalizationResult result) {
        return new NetworkLoadResult(result.sourceName(), true, result, null);
    }

    public static NetworkLoadResult failed(String sourceName, String error) {
        return new NetworkLoadResult(sourceName, false, null, error);
    }

    public Optional<NormalizationResult> resultIfPresent() {
        return Optional.ofNullable(result);
    }
}
