package com.routewise.core.model;

import java.io.Serializable;

/**
 * A runner-up handler reported alongside a routing decision.
 */
public record Alternative(
    String handlerId,
    double confidence,
    String reasoning
) implements Serializable {}
