package com.pathwayloader.cli;

import com.pathwayloader.core.config.LoaderConfig;
import com.pathwayloader.core.emit.CxWriter;
import com.pathwayloader.core.output.NetworkOutput;
import com.pathwayloader.core.output.OutputContext;
import com.pathwayloader.core.output.OutputWriter;
import com.pathwayloader.core.output.impl.ConsoleOutputWriter;
import com.pathwayloader.core.output.impl.FileSystemOutputWriter;
import com.pathwayloader.core.parser.NetworkFileParser;
import com.pathwayloader.core.pipeline.BatchSummary;
import com.pathwayloader.core.pipeline.NetworkBatchLoader;
import com.pathwayloader.core.pipeline.NetworkLoadResult;
import com.pathwayloader.core.pipeline.NormalizationPipeline;
import com.pathwayloader.core.pipeline.NormalizationResult;
import com.pathwayloader.core.report.BatchOutputBuilder;
import com.pathwayloader.core.report.FindingReportFormatter;
import com.pathwayloader.core.util.FileUtils;
import com.pathwayloader.core.validate.GeneSymbolAuthority;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to normalize a directory of network files and write the results.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration and the gene symbol list</li>
 *   <li>Select network files (directory glob, or the network list file)</li>
 *   <li>Parse and normalize each file; failures are isolated per file</li>
 *   <li>Write one CX file per network plus the finding reports</li>
 * </ol>
 *
 * <p>Exit codes: 0 all networks loaded, 1 fatal error, 2 some networks failed.
 */
@Command(
    name = "load",
    description = "Normalize network files and write CX networks and finding reports",
    mixinStandardHelpOptions = true
)
public class LoadCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LoadCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Directory containing network files (default: input.directory from config)"
    )
    private Path dataDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: pathway-loader.yaml)")
    private Path configPath = Paths.get("pathway-loader.yaml");

    @Option(names = {"-g", "--gene-symbols"}, description = "Gene symbol list or HGNC TSV export (overrides config)")
    private Path geneSymbols;

    @Option(names = {"-l", "--networklist"}, description = "File listing the network files to load, one per line")
    private Path networkList;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--dry-run"}, description = "Normalize but only list the files that would be written")
    private boolean dryRun;

    @Option(names = {"--show-content"}, description = "With --dry-run, also print the content of each file")
    private boolean showContent;

    @Option(names = {"--no-reports"}, description = "Do not write finding reports")
    private boolean noReports;

    @Override
    public Integer call() {
        try {
            LoaderConfig config = CommandSupport.loadConfig(configPath);
            GeneSymbolAuthority authority = CommandSupport.loadAuthority(config, geneSymbols);

            List<Path> files = selectFiles(config);
            System.out.println("Loading " + files.size() + " network files");

            NetworkBatchLoader loader = new NetworkBatchLoader(new NetworkFileParser(),
                NormalizationPipeline.create(config, authority));
            BatchSummary summary = loader.loadAll(files);
            printSummary(summary);

            boolean reports = !noReports && config.output().writeReports();
            NetworkOutput output = new BatchOutputBuilder(new CxWriter(), new FindingReportFormatter())
                .build(summary, reports);

            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            OutputWriter writer = dryRun ? new ConsoleOutputWriter() : new FileSystemOutputWriter();
            writer.write(output, new OutputContext(directory,
                Map.of(ConsoleOutputWriter.SHOW_CONTENT, String.valueOf(showContent))));

            return summary.hasFailures() ? CommandSupport.EXIT_NETWORK_FAILURES : CommandSupport.EXIT_OK;
        } catch (Exception e) {
            log.error("Load failed", e);
            System.err.println("✗ Load failed: " + e.getMessage());
            return CommandSupport.EXIT_ERROR;
        }
    }

    private List<Path> selectFiles(LoaderConfig config) throws IOException {
        Path directory = dataDir != null ? dataDir : Paths.get(config.input().directory());
        Path listFile = networkList;
        if (listFile == null && config.input().networkListFile() != null) {
            listFile = Paths.get(config.input().networkListFile());
        }
        if (listFile != null) {
            log.debug("Reading network list: {}", listFile);
            return FileUtils.readNetworkList(listFile).stream().map(directory::resolve).toList();
        }
        return FileUtils.findNetworkFiles(directory, config.input().filePattern());
    }

    private void printSummary(BatchSummary summary) {
        for (NormalizationResult result : summary.succeeded()) {
            System.out.printf("✓ %s: %d nodes, %d edges, %d findings%n", result.sourceName(),
                result.statistics().nodesEmitted(), result.statistics().edgesEmitted(), result.findings().size());
        }
        for (NetworkLoadResult failed : summary.failed()) {
            System.out.println("✗ " + failed.sourceName() + ": " + failed.error());
        }
    }
}
