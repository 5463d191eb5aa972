package com.pathwayloader.cli;

import com.pathwayloader.core.config.ConfigLoader;
import com.pathwayloader.core.config.LoaderConfig;
import com.pathwayloader.core.validate.GeneSymbolAuthority;
import com.pathwayloader.core.validate.GeneSymbolLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Setup shared by the commands: configuration and naming authority loading.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NETWORK_FAILURES = 2;

    private CommandSupport() {
    }

    static LoaderConfig loadConfig(Path configPath) {
        log.debug("Loading configuration from: {}", configPath);
        return ConfigLoader.load(configPath);
    }

    /**
     * Loads the naming authority from the override path or the configured file.
     *
     * @param config loader configuration
     * @param override path given on the command line, may be null
     * @return authority; accepts every symbol when no file is configured
     * @throws IOException if the symbol file cannot be read
     */
    static GeneSymbolAuthority loadAuthority(LoaderConfig config, Path override) throws IOException {
        Path file = override;
        if (file == null && config.geneSymbols().file() != null) {
            file = Paths.get(config.geneSymbols().file());
        }
        if (file == null) {
            log.warn("No gene symbol file configured. Gene names will not be validated.");
            return GeneSymbolAuthority.acceptAll();
        }
        return new GeneSymbolLoader(config.geneSymbols().column()).load(file);
    }
}
