package com.routewise.core.model;

/**
 * How strongly a handler is associated with a single task type.
 * <p>
 * Each level carries the confidence the scorer assigns to a task-type term.
 */
public enum MatchLevel {
    PRIMARY(0.95),
    SECONDARY(0.80),
    CAPABILITY_OVERLAP(0.60),
    NONE(0.20);

    private final double confidence;

    MatchLevel(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }
}
