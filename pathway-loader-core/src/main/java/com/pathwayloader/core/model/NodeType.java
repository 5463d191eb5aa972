package com.pathwayloader.core.model;

import java.util.Locale;

/**
 * Type tag of a network node.
 *
 * <p>The tag decides two things: whether the node is validated against the gene
 * naming authority ({@link #GENE}) and whether it may carry flattened members
 * ({@link #isComplex()}).
 */
public enum NodeType {
    /** Single named genetic entity */
    GENE("gene"),
    /** Protein complex */
    COMPLEX("complex"),
    /** Gene family */
    FAMILY("family"),
    /** Generic family whose members are interchangeable */
    GENERIC_FAMILY("generic family"),
    /** Cellular compartment, a visual container only */
    COMPARTMENT("compartment"),
    /** Biological process */
    PROCESS("process"),
    /** Any tag not recognized above */
    OTHER("other");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    /**
     * Returns the lower-case label used as the {@code type} node attribute.
     *
     * @return emission label
     */
    public String label() {
        return label;
    }

    /**
     * Returns true for group nodes whose semantic content is their member set.
     *
     * @return true for complex, family and generic family nodes
     */
    public boolean isComplex() {
        return this == COMPLEX || this == FAMILY || this == GENERIC_FAMILY;
    }

    /**
     * Maps a raw type tag from an input file to a node type.
     *
     * <p>Matching is case-insensitive and ignores surrounding whitespace as well as
     * spaces, dashes and underscores, so {@code "Generic Family"} and
     * {@code "GENERIC_FAMILY"} both map to {@link #GENERIC_FAMILY}.
     *
     * @param tag raw tag, may be null
     * @return matching type, or {@link #OTHER} if the tag is unknown or blank
     */
    public static NodeType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return OTHER;
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s_-]", "");
        return switch (normalized) {
            case "GENE" -> GENE;
            case "COMPLEX" -> COMPLEX;
            case "FAMILY" -> FAMILY;
            case "GENERICFAMILY" -> GENERIC_FAMILY;
            case "COMPARTMENT" -> COMPARTMENT;
            case "PROCESS" -> PROCESS;
            default -> OTHER;
        };
    }
}
