package com.routewise.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of selection: which handler runs the task and how sure the router is.
 *
 * @param selectedHandlerId handler chosen to execute the task
 * @param confidence        confidence of the selected handler
 * @param reasoning         reasoning of the selected handler's score
 * @param alternatives      up to two runner-up handlers, best first
 * @param taskProfile       the analyzed task the decision was made for
 * @param lowConfidence     true when confidence is below the configured minimum (informational)
 * @param timestamp         when the decision was made
 */
public record RoutingDecision(
    String selectedHandlerId,
    double confidence,
    String reasoning,
    List<Alternative> alternatives,
    TaskProfile taskProfile,
    boolean lowConfidence,
    Instant timestamp
) implements Serializable {

    public RoutingDecision {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
