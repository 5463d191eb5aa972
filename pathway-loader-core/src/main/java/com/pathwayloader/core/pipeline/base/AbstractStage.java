package com.pathwayloader.core.pipeline.base;

import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.pipeline.PipelineStage;
import com.pathwayloader.core.pipeline.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Abstract base class for pipeline stages providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per stage class)</li>
 *   <li>StageResult creation helpers ({@link #unchanged(NetworkTables)}, {@link #result})</li>
 *   <li>Interaction label normalization ({@link #interactionKey(String)})</li>
 * </ul>
 *
 * @see PipelineStage
 * @see StageResult
 */
public abstract class AbstractStage implements PipelineStage {

    /**
     * Logger instance for this stage.
     * Automatically initialized with the concrete stage class name.
     */
    protected final Logger log;

    protected AbstractStage() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Creates a result that passes the tables through untouched.
     *
     * @param tables input tables
     * @return result with no findings, warnings or counters
     */
    protected StageResult unchanged(NetworkTables tables) {
        return new StageResult(getId(), tables, List.of(), List.of(), Map.of());
    }

    /**
     * Creates a result for this stage.
     *
     * @param tables transformed tables
     * @param findings advisory findings (can be empty)
     * @param warnings repaired input defects (can be empty)
     * @param counters named counts (can be empty)
     * @return stage result
     */
    protected StageResult result(
            NetworkTables tables,
            List<Finding> findings,
            List<String> warnings,
            Map<String, Integer> counters) {
        return new StageResult(getId(), tables, findings, warnings, counters);
    }

    /**
     * Normalizes an interaction label for comparison: trimmed, upper case.
     *
     * @param interactionType raw label
     * @return comparison key
     */
    protected static String interactionKey(String interactionType) {
        return interactionType.trim().toUpperCase(Locale.ROOT);
    }
}
