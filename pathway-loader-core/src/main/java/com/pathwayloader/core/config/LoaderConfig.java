package com.pathwayloader.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Root configuration for the pathway loader.
 *
 * <p>Loaded from {@code pathway-loader.yaml}. Defines where network files and the gene
 * symbol list live, how membership and undirected interactions are labelled, which
 * constant attributes every network carries and where output goes.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * input:
 *   directory: "./networks"
 *   filePattern: "*.txt"
 *
 * geneSymbols:
 *   file: "./hgnc_symbols.tsv"
 *   column: "symbol"
 *
 * interactions:
 *   membershipTypes: [IS_MEMBER_OF]
 *   undirectedTypes: [BINDS]
 *
 * network:
 *   attributes:
 *     version: "1.0"
 *     organism: "Human, 9606, Homo sapiens"
 *
 * output:
 *   directory: "./out"
 *   writeReports: true
 * }</pre>
 *
 * @param input input file settings
 * @param geneSymbols naming authority source
 * @param interactions interaction label taxonomy
 * @param network constant network attributes
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoaderConfig(
    @JsonProperty("input") InputConfig input,
    @JsonProperty("geneSymbols") GeneSymbolConfig geneSymbols,
    @JsonProperty("interactions") InteractionConfig interactions,
    @JsonProperty("network") NetworkConfig network,
    @JsonProperty("output") OutputConfig output
) {
    public static final List<String> DEFAULT_MEMBERSHIP_TYPES = List.of("IS_MEMBER_OF", "MEMBER_OF");
    public static final List<String> DEFAULT_UNDIRECTED_TYPES = List.of("BINDS");

    /**
     * Compact constructor filling in defaults for absent sections.
     */
    public LoaderConfig {
        if (input == null) {
            input = new InputConfig(null, null, null);
        }
        if (geneSymbols == null) {
            geneSymbols = new GeneSymbolConfig(null, null);
        }
        if (interactions == null) {
            interactions = new InteractionConfig(null, null);
        }
        if (network == null) {
            network = new NetworkConfig(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static LoaderConfig defaults() {
        return new LoaderConfig(null, null, null, null, null);
    }

    /**
     * Input file settings.
     *
     * @param directory directory holding network files
     * @param filePattern glob for network files inside the directory
     * @param networkListFile optional file listing the network files to load
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("filePattern") String filePattern,
        @JsonProperty("networkListFile") String networkListFile
    ) {
        public InputConfig {
            if (directory == null) {
                directory = ".";
            }
            if (filePattern == null) {
                filePattern = "*.txt";
            }
        }
    }

    /**
     * Naming authority source.
     *
     * @param file path to a symbol list or TSV export, null when validation is disabled
     * @param column symbol column for TSV exports
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneSymbolConfig(
        @JsonProperty("file") String file,
        @JsonProperty("column") String column
    ) {
        public GeneSymbolConfig {
            if (column == null) {
                column = "symbol";
            }
        }
    }

    /**
     * Interaction label taxonomy. Labels compare case-insensitively.
     *
     * @param membershipTypes edge labels that encode "source is a member of target"
     * @param undirectedTypes edge labels whose direction carries no meaning
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InteractionConfig(
        @JsonProperty("membershipTypes") List<String> membershipTypes,
        @JsonProperty("undirectedTypes") List<String> undirectedTypes
    ) {
        public InteractionConfig {
            membershipTypes = membershipTypes == null ? DEFAULT_MEMBERSHIP_TYPES : List.copyOf(membershipTypes);
            undirectedTypes = undirectedTypes == null ? DEFAULT_UNDIRECTED_TYPES : List.copyOf(undirectedTypes);
        }

        public Set<String> membershipTypeKeys() {
            return normalize(membershipTypes);
        }

        public Set<String> undirectedTypeKeys() {
            return normalize(undirectedTypes);
        }

        private static Set<String> normalize(List<String> labels) {
            return labels.stream()
                .map(label -> label.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        }
    }

    /**
     * Network level emission settings.
     *
     * @param attributes constant attribute name to value, in declaration order
     * @param columnNames input column name to the attribute name it is emitted under
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkConfig(
        @JsonProperty("attributes") Map<String, String> attributes,
        @JsonProperty("columnNames") Map<String, String> columnNames
    ) {
        public NetworkConfig {
            attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            columnNames = columnNames == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columnNames));
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param writeReports whether finding reports are written
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("writeReports") Boolean writeReports
    ) {
        public OutputConfig {
            if (directory == null) {
                directory = "./out";
            }
            if (writeReports == null) {
                writeReports = Boolean.TRUE;
            }
        }
    }
}
