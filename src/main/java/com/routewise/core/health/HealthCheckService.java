package com.routewise.core.health;

import com.routewise.core.registry.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs each registered handler's self-check and summarizes router health.
 * Never throws: a failing self-check is reported as DOWN with its message.
 */
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String ROUTER_COMPONENT = "router";

    private final CapabilityRegistry registry;

    public HealthCheckService(CapabilityRegistry registry) {
        this.registry = registry;
    }

    public HealthSnapshot check() {
        var handlers = new LinkedHashMap<String, HealthStatus>();
        int up = 0;
        for (var registration : registry.registrations()) {
            HealthStatus status = checkHandler(registration);
            handlers.put(registration.id(), status);
            if (status.status() == HealthStatus.Status.UP) {
                up++;
            }
        }
        return new HealthSnapshot(routerStatus(handlers.size(), up), Collections.unmodifiableMap(handlers));
    }

    private HealthStatus checkHandler(CapabilityRegistry.Registration registration) {
        var metadata = Map.of(
                "capabilities", String.valueOf(registration.descriptor().capabilities().size()),
                "tools", String.valueOf(registration.descriptor().tools().size()));
        try {
            registration.handler().selfCheck();
            return new HealthStatus(registration.id(), HealthStatus.Status.UP, "Handler available", metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus(registration.id(), HealthStatus.Status.DOWN,
                    "Self-check interrupted", metadata);
        } catch (Exception e) {
            log.warn("Handler {} health check failed: {}", registration.id(), e.getMessage());
            return new HealthStatus(registration.id(), HealthStatus.Status.DOWN,
                    "Handler error: " + e.getMessage(), metadata);
        }
    }

    private static HealthStatus routerStatus(int total, int up) {
        var metadata = Map.of("handlers", String.valueOf(total), "available", String.valueOf(up));
        if (total == 0) {
            return new HealthStatus(ROUTER_COMPONENT, HealthStatus.Status.DOWN, "No handlers registered", metadata);
        }
        if (up == 0) {
            return new HealthStatus(ROUTER_COMPONENT, HealthStatus.Status.DOWN, "No handler reachable", metadata);
        }
        if (up < total) {
            return new HealthStatus(ROUTER_COMPONENT, HealthStatus.Status.DEGRADED,
                    (total - up) + " of " + total + " handlers down", metadata);
        }
        return new HealthStatus(ROUTER_COMPONENT, HealthStatus.Status.UP, "All handlers available", metadata);
    }
}
