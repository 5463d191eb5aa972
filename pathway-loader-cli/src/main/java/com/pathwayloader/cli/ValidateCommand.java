package com.pathwayloader.cli;

import com.pathwayloader.core.config.LoaderConfig;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.parser.NetworkFileParser;
import com.pathwayloader.core.pipeline.BatchSummary;
import com.pathwayloader.core.pipeline.NetworkBatchLoader;
import com.pathwayloader.core.pipeline.NetworkLoadResult;
import com.pathwayloader.core.pipeline.NormalizationPipeline;
import com.pathwayloader.core.pipeline.NormalizationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to normalize network files and print findings and warnings without writing output.
 */
@Command(
    name = "validate",
    description = "Check network files and print findings",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(arity = "1..*", description = "Network files to check")
    private List<Path> files;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: pathway-loader.yaml)")
    private Path configPath = Paths.get("pathway-loader.yaml");

    @Option(names = {"-g", "--gene-symbols"}, description = "Gene symbol list or HGNC TSV export (overrides config)")
    private Path geneSymbols;

    @Override
    public Integer call() {
        try {
            LoaderConfig config = CommandSupport.loadConfig(configPath);
            NetworkBatchLoader loader = new NetworkBatchLoader(new NetworkFileParser(),
                NormalizationPipeline.create(config, CommandSupport.loadAuthority(config, geneSymbols)));
            BatchSummary summary = loader.loadAll(files);

            for (NetworkLoadResult entry : summary.results()) {
                if (!entry.success()) {
                    System.out.println("✗ " + entry.sourceName() + ": " + entry.error());
                    continue;
                }
                NormalizationResult result = entry.result();
                System.out.println("✓ " + result.sourceName());
                for (Finding finding : result.findings()) {
                    System.out.printf("    %s %s (%s): %s%n", finding.type(), finding.nodeId(),
                        finding.nodeName(), finding.detail());
                }
                for (String warning : result.warnings()) {
                    System.out.println("    WARNING " + warning);
                }
            }
            return summary.hasFailures() ? CommandSupport.EXIT_NETWORK_FAILURES : CommandSupport.EXIT_OK;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return CommandSupport.EXIT_ERROR;
        }
    }
}
