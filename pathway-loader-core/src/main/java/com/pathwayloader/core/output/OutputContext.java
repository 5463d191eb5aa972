package com.pathwayloader.core.output;

import java.util.Map;
import java.util.Objects;

/**
 * Settings passed to an {@link OutputWriter}.
 *
 * @param outputDirectory target directory
 * @param settings writer specific settings
 */
public record OutputContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public OutputContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
