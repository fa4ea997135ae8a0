package com.routewise.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task is routed and dispatched.
 *
 * @param eventType event type (e.g. "route.selected", "dispatch.completed", "dispatch.fallback")
 * @param routingId the routing call this event belongs to
 * @param handlerId the handler this event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RoutingEvent(
    String eventType,
    String routingId,
    String handlerId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
