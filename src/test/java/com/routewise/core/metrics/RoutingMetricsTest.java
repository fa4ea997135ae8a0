package com.routewise.core.metrics;

import com.routewise.core.model.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoutingMetricsTest {

    private SimpleMeterRegistry registry;
    private RoutingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RoutingMetrics(registry);
    }

    @Test
    @DisplayName("recordDecision counts per handler and records confidence")
    void recordDecision() {
        metrics.recordDecision("frontend", 0.9);
        metrics.recordDecision("frontend", 0.7);
        metrics.recordDecision("backend", 0.5);

        var frontend = registry.find("routewise.routing.decisions").tag("handler", "frontend").counter();
        assertNotNull(frontend);
        assertEquals(2.0, frontend.count());

        var confidence = registry.find("routewise.routing.confidence").summary();
        assertNotNull(confidence);
        assertEquals(3, confidence.count());
        assertEquals(2.1, confidence.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordDispatch records by handler and outcome tag")
    void recordDispatch() {
        metrics.recordDispatch("frontend", "success", 120);
        metrics.recordDispatch("frontend", "fallback", 300);

        var success = registry.find("routewise.dispatch.duration")
                .tag("handler", "frontend").tag("outcome", "success").timer();
        var fallback = registry.find("routewise.dispatch.duration")
                .tag("handler", "frontend").tag("outcome", "fallback").timer();
        assertNotNull(success);
        assertNotNull(fallback);
        assertEquals(1, success.count());
        assertEquals(1, fallback.count());
    }

    @Test
    @DisplayName("recordFallback and recordFailure increment tagged counters")
    void fallbackAndFailure() {
        metrics.recordFallback("backend");
        metrics.recordFailure(ErrorKind.EMPTY_REGISTRY);
        metrics.recordFailure(ErrorKind.EMPTY_REGISTRY);

        assertEquals(1.0, registry.find("routewise.dispatch.fallbacks").tag("handler", "backend").counter().count());
        assertEquals(2.0, registry.find("routewise.routing.failures").tag("kind", "EMPTY_REGISTRY").counter().count());
    }
}
