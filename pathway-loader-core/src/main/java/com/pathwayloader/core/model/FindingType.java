package com.pathwayloader.core.model;

/**
 * Kind of an advisory finding. Findings never change which nodes or edges survive.
 */
public enum FindingType {
    /** Gene display name not known to the naming authority */
    INVALID_GENE_NAME,
    /** Complex node found as a member of another complex node */
    NESTED_COMPLEX,
    /** Membership expansion stopped because the containment relation loops */
    MEMBERSHIP_CYCLE
}
