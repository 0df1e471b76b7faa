package org.carball.placement.analyzer;

/**
 * Thrown when baselines are requested for a batch without placements.
 */
public class EmptyBatchException extends IllegalArgumentException {

    public EmptyBatchException(String message) {
        super(message);
    }
}
