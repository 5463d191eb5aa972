package com.pathwayloader.core.pipeline;

/**
 * Thrown when assembled tables break an internal invariant: a dangling edge or
 * membership reference, a nested complex left after flattening, a duplicate edge or
 * an orphan gene.
 *
 * <p>Indicates a defect in the normalization stages rather than bad input. Fatal for the
 * network being processed only.
 */
public class NetworkConsistencyException extends RuntimeException {

    public NetworkConsistencyException(String message) {
        super(message);
    }
}
