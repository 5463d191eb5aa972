package com.pathwayloader;

import com.pathwayloader.cli.LoadCommand;
import com.pathwayloader.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for the pathway loader.
 *
 * <p>Reads PathwayMapper network files, normalizes them (gene name validation, complex
 * flattening, edge deduplication, orphan pruning) and writes CX networks plus finding
 * reports.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code load} - Normalize a directory of network files and write CX output</li>
 *   <li>{@code validate} - Normalize files and print findings without writing anything</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * pathway-loader load ./networks --gene-symbols hgnc.tsv -o ./out
 * pathway-loader -v validate ./networks/wnt.txt
 * }</pre>
 */
@Command(
    name = "pathway-loader",
    mixinStandardHelpOptions = true,
    version = "Pathway Loader 1.0.0-SNAPSHOT",
    description = "Normalizes PathwayMapper network files into CX networks",
    subcommands = {
        LoadCommand.class,
        ValidateCommand.class
    }
)
public class PathwayLoaderCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PathwayLoaderCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Pathway Loader - PathwayMapper to CX network normalizer");
        System.out.println();
        System.out.println("Use 'pathway-loader --help' to see available commands");
        System.out.println("Use 'pathway-loader <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PathwayLoaderCLI cli = new PathwayLoaderCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
