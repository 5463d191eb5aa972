package com.pathwayloader.core.model;

/**
 * Free-text metadata harvested from the header of a network file.
 *
 * @param title first header line, empty if absent
 * @param description remaining header lines joined by a space, empty if absent
 */
public record NetworkDescription(
    String title,
    String description
) {
    /**
     * Compact constructor normalizing nulls to empty strings.
     */
    public NetworkDescription {
        title = title == null ? "" : title.trim();
        description = description == null ? "" : description.trim();
    }

    public static NetworkDescription empty() {
        return new NetworkDescription("", "");
    }
}
