package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.model.NetworkTables;

/**
 * One step of the network normalization pipeline.
 *
 * <p>A stage is a pure transform: it receives the table triple produced by the previous
 * stage and returns a new one together with any findings. Stages hold no per-network
 * state, so one instance can serve any number of networks, including concurrently.
 *
 * <p>Stages run in the fixed order name validation, nesting resolution, edge
 * deduplication, graph assembly. See {@link NormalizationPipeline}.
 *
 * @see StageResult
 * @see com.pathwayloader.core.pipeline.base.AbstractStage
 */
public interface PipelineStage {

    /**
     * Returns unique identifier for this stage.
     *
     * <p>Used in logs and statistics. Should be kebab-case (e.g., "edge-deduplication").
     *
     * @return unique stage identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this stage.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Applies the stage to one network.
     *
     * @param tables tables produced by the previous stage
     * @return new tables with findings, warnings and counters
     */
    StageResult apply(NetworkTables tables);
}
