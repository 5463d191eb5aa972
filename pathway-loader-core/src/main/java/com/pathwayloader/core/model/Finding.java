package com.pathwayloader.core.model;

import java.util.Objects;

/**
 * Observational record produced by a pipeline stage.
 *
 * @param type finding kind
 * @param nodeId identifier of the node the finding is about
 * @param nodeName display name of that node
 * @param detail human readable detail, e.g. the nested complex
 */
public record Finding(
    FindingType type,
    String nodeId,
    String nodeName,
    String detail
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        if (nodeName == null) {
            nodeName = "";
        }
        if (detail == null) {
            detail = "";
        }
    }
}
