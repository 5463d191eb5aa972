package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.config.LoaderConfig;
import com.pathwayloader.core.emit.NetworkDocument;
import com.pathwayloader.core.emit.NetworkEmitter;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.parser.ParsedNetwork;
import com.pathwayloader.core.pipeline.stage.EdgeDeduplicationStage;
import com.pathwayloader.core.pipeline.stage.GraphAssemblyStage;
import com.pathwayloader.core.pipeline.stage.NameValidationStage;
import com.pathwayloader.core.pipeline.stage.NestingResolutionStage;
import com.pathwayloader.core.util.FileUtils;
import com.pathwayloader.core.validate.GeneSymbolAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the normalization stages over one parsed network and emits the result.
 *
 * <p>Stages run in list order, each consuming the tables of the previous one. Findings
 * and warnings are concatenated in stage order. The assembled tables are checked by
 * {@link ConsistencyChecker} before the {@link NetworkEmitter} runs.
 *
 * <p>The pipeline keeps no per-network state; independent networks may be normalized
 * concurrently with one instance.
 */
public class NormalizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    private final List<PipelineStage> stages;
    private final ConsistencyChecker checker;
    private final NetworkEmitter emitter;

    public NormalizationPipeline(List<PipelineStage> stages, ConsistencyChecker checker, NetworkEmitter emitter) {
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages must not be null"));
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
    }

    /**
     * Creates the standard pipeline: name validation, nesting resolution, edge
     * deduplication, graph assembly.
     *
     * @param config loader configuration (interaction labels, network attributes)
     * @param authority gene naming authority
     * @return configured pipeline
     */
    public static NormalizationPipeline create(LoaderConfig config, GeneSymbolAuthority authority) {
        LoaderConfig.InteractionConfig interactions = config.interactions();
        List<PipelineStage> stages = List.of(
            new NameValidationStage(authority),
            new NestingResolutionStage(interactions.membershipTypeKeys()),
            new EdgeDeduplicationStage(interactions.undirectedTypeKeys()),
            new GraphAssemblyStage()
        );
        return new NormalizationPipeline(stages, new ConsistencyChecker(),
            new NetworkEmitter(config.network().attributes(), config.network().columnNames()));
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    /**
     * Normalizes one network.
     *
     * @param parsed parser output
     * @return assembled tables, emitted network, findings and statistics
     * @throws NetworkConsistencyException if the assembled tables break an invariant
     */
    public NormalizationResult run(ParsedNetwork parsed) {
        String name = parsed.sourceName();
        NetworkTables tables = parsed.tables();
        List<Finding> findings = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> counters = new HashMap<>();

        for (PipelineStage stage : stages) {
            log.debug("{}: running {}", name, stage.getDisplayName());
            StageResult result = stage.apply(tables);
            tables = result.tables();
            findings.addAll(result.findings());
            warnings.addAll(result.warnings());
            result.counters().forEach((key, value) -> counters.merge(key, value, Integer::sum));
        }

        checker.check(name, tables);
        NetworkDocument document = emitter.emit(tables, parsed.description(), FileUtils.baseName(name));

        PipelineStatistics statistics = new PipelineStatistics(
            parsed.tables().nodes().size(),
            parsed.tables().edges().size(),
            counters.getOrDefault(PipelineStatistics.MEMBERSHIP_EDGES_CONSUMED, 0),
            tables.memberships().size(),
            counters.getOrDefault(PipelineStatistics.DUPLICATE_EDGES_REMOVED, 0),
            counters.getOrDefault(PipelineStatistics.DANGLING_EDGES_DROPPED, 0),
            counters.getOrDefault(PipelineStatistics.ORPHAN_GENES_PRUNED, 0),
            counters.getOrDefault(PipelineStatistics.COMPARTMENTS_REMOVED, 0),
            document.nodes().size(),
            document.edges().size()
        );
        log.info("{}: {} nodes, {} edges, {} findings", name, statistics.nodesEmitted(),
            statistics.edgesEmitted(), findings.size());

        return new NormalizationResult(name, parsed.description(), tables, document, findings, warnings, statistics);
    }
}
