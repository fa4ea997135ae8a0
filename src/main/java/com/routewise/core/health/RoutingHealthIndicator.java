package com.routewise.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the routing engine.
 * <p>
 * Reports UP while at least one handler is reachable (with a per-handler breakdown
 * in the details), DOWN otherwise.
 */
@Component("routingHealthIndicator")
public class RoutingHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public RoutingHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthSnapshot snapshot = healthCheckService.check();
        var builder = snapshot.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("router", snapshot.router().detail());
        snapshot.handlers().forEach((id, status) ->
                builder.withDetail(id, status.status().name() + ": " + status.detail()));
        return builder.build();
    }
}
