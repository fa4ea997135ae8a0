package com.routewise.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One dispatched decision and its outcome, as kept in routing history.
 */
public record HistoryRecord(
    RoutingDecision decision,
    ExecutionOutcome outcome,
    Instant timestamp
) implements Serializable {}
