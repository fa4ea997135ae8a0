package com.routewise.core.engine;

import com.routewise.core.model.ErrorKind;
import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.RoutingDecision;

/**
 * Thrown when a routing call cannot produce a result: the registry is empty, or both
 * the selected handler and the fallback handler failed.
 * <p>
 * For {@link ErrorKind#COMPLETE_ROUTING_FAILURE} the decision and the failed outcome
 * are attached so callers can still inspect what was attempted.
 */
public class RoutingException extends RuntimeException {

    private final ErrorKind kind;
    private final RoutingDecision decision;
    private final ExecutionOutcome outcome;

    public RoutingException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public RoutingException(ErrorKind kind, String message, RoutingDecision decision,
                            ExecutionOutcome outcome, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.decision = decision;
        this.outcome = outcome;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The decision that was dispatched, or null when none was made. */
    public RoutingDecision decision() {
        return decision;
    }

    /** The failed outcome, or null when nothing was dispatched. */
    public ExecutionOutcome outcome() {
        return outcome;
    }
}
