package com.routewise.core.model;

import java.io.Serializable;

/**
 * Fit of one handler for one task profile.
 *
 * @param handlerId           the scored handler
 * @param confidence          normalized fit in [0, 1]
 * @param reasoning           short explanation of the strongest fit factors
 * @param estimatedEfficiency unclamped weighted average scaled by 0.9
 */
public record Score(
    String handlerId,
    double confidence,
    String reasoning,
    double estimatedEfficiency
) implements Serializable {}
