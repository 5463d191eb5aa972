package com.pathwayloader.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading loader configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code pathway-loader.yaml} into {@link LoaderConfig}.
 * If the file is missing, empty or invalid, returns {@link LoaderConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LoaderConfig config = ConfigLoader.load(Paths.get("pathway-loader.yaml"));
 * Set<String> undirected = config.interactions().undirectedTypeKeys();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code pathway-loader.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static LoaderConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return LoaderConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return LoaderConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            LoaderConfig config = YAML_MAPPER.readValue(configPath.toFile(), LoaderConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return LoaderConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return LoaderConfig.defaults();
        }
    }
}
