package com.routewise.core.metrics;

import com.routewise.core.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing and dispatch.
 */
@Service
public class RoutingMetrics {

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String handlerId, double confidence) {
        Counter.builder("routewise.routing.decisions")
                .tag("handler", handlerId)
                .register(registry)
                .increment();

        DistributionSummary.builder("routewise.routing.confidence")
                .description("Confidence of selected handlers")
                .register(registry)
                .record(confidence);
    }

    /**
     * @param handlerId the selected handler
     * @param outcome   "success", "fallback", "failure" or "cancelled"
     * @param ms        dispatch wall-clock time
     */
    public void recordDispatch(String handlerId, String outcome, long ms) {
        Timer.builder("routewise.dispatch.duration")
                .tag("handler", handlerId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFallback(String failedHandlerId) {
        Counter.builder("routewise.dispatch.fallbacks")
                .description("Dispatches recovered by the fallback handler")
                .tag("handler", failedHandlerId)
                .register(registry)
                .increment();
    }

    public void recordFailure(ErrorKind kind) {
        Counter.builder("routewise.routing.failures")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }
}
