package com.routewise.core.engine;

import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.RoutingDecision;
import com.routewise.core.model.TaskResult;

/**
 * Everything a routing call produced.
 *
 * @param routingId unique id of this routing call (e.g. "ROUTE-2026-0001")
 * @param decision  the routing decision
 * @param outcome   the dispatch outcome; unsuccessful only when cancelled
 * @param result    the handler result, null when cancelled
 */
public record RoutingResult(
    String routingId,
    RoutingDecision decision,
    ExecutionOutcome outcome,
    TaskResult result
) {}
