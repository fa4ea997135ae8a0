package com.routewise.core.health;

import java.util.Map;

/**
 * Health of the router and each registered handler.
 *
 * @param router   aggregate router status: UP when every handler is up, DEGRADED when at least
 *                 one is up, DOWN when none is registered or reachable
 * @param handlers per-handler status keyed by handler id, in registration order
 */
public record HealthSnapshot(
    HealthStatus router,
    Map<String, HealthStatus> handlers
) {
    /**
     * True iff at least one handler is registered and reachable.
     */
    public boolean isHealthy() {
        return router.status() != HealthStatus.Status.DOWN;
    }
}
