package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.parser.NetworkFileParser;
import com.pathwayloader.core.parser.NetworkParseException;
import com.pathwayloader.core.parser.ParsedNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses and normalizes network files one after another.
 *
 * <p>Each file is isolated: a parse error, a consistency violation or an I/O failure
 * marks that file as failed and processing continues with the next one.
 */
public class NetworkBatchLoader {

    private static final Logger log = LoggerFactory.getLogger(NetworkBatchLoader.class);

    private final NetworkFileParser parser;
    private final NormalizationPipeline pipeline;

    public NetworkBatchLoader(NetworkFileParser parser, NormalizationPipeline pipeline) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Loads every file in order.
     *
     * @param files network files
     * @return per-file results
     */
    public BatchSummary loadAll(List<Path> files) {
        List<NetworkLoadResult> results = new ArrayList<>();
        for (Path file : files) {
            results.add(load(file));
        }
        BatchSummary summary = new BatchSummary(results);
        log.info("Processed {} networks: {} succeeded, {} failed",
            results.size(), summary.succeeded().size(), summary.failed().size());
        return summary;
    }

    /**
     * Loads one file, converting any per-network failure into a failed result.
     *
     * @param file network file
     * @return load result
     */
    public NetworkLoadResult load(Path file) {
        String sourceName = file.getFileName().toString();
        try {
            ParsedNetwork parsed = parser.parse(file);
            return NetworkLoadResult.succeeded(pipeline.run(parsed));
        } catch (NetworkParseException e) {
            log.error("Skipping {}: {}", sourceName, e.getMessage());
            return NetworkLoadResult.failed(sourceName, e.getMessage());
        } catch (NetworkConsistencyException e) {
            log.error("Consistency violation in {}", sourceName, e);
            return NetworkLoadResult.failed(sourceName, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return NetworkLoadResult.failed(sourceName, "Failed to read file: " + e.getMessage());
        }
    }
}
