package com.routewise.core.engine;

import com.routewise.core.analysis.TaskAnalyzer;
import com.routewise.core.dispatch.DispatchResult;
import com.routewise.core.dispatch.ExecutionDispatcher;
import com.routewise.core.events.EventBus;
import com.routewise.core.events.RoutingEvent;
import com.routewise.core.handler.Handler;
import com.routewise.core.health.HealthCheckService;
import com.routewise.core.health.HealthSnapshot;
import com.routewise.core.history.RoutingStats;
import com.routewise.core.history.StatsAggregator;
import com.routewise.core.logging.MdcContext;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.ErrorKind;
import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.HandlerDescriptor;
import com.routewise.core.model.RoutingDecision;
import com.routewise.core.model.Task;
import com.routewise.core.model.TaskProfile;
import com.routewise.core.registry.CapabilityRegistry;
import com.routewise.core.scoring.ScoringEngine;
import com.routewise.core.selection.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point of the router: analyze, score, select, dispatch, record.
 * <p>
 * Analysis, scoring and selection are stateless, so any number of {@link #route} calls
 * may run in parallel. The only shared mutable state is the registry (copy-on-write)
 * and the routing history (locked).
 */
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);
    private static final AtomicInteger ROUTING_COUNTER = new AtomicInteger(0);

    private final CapabilityRegistry registry;
    private final TaskAnalyzer analyzer;
    private final ScoringEngine scoringEngine;
    private final Selector selector;
    private final ExecutionDispatcher dispatcher;
    private final StatsAggregator statsAggregator;
    private final HealthCheckService healthCheckService;
    private final EventBus eventBus;
    private final RoutingMetrics metrics;
    private final ExecutorService executor;

    public RoutingEngine(CapabilityRegistry registry, TaskAnalyzer analyzer, ScoringEngine scoringEngine,
                         Selector selector, ExecutionDispatcher dispatcher, StatsAggregator statsAggregator,
                         HealthCheckService healthCheckService, EventBus eventBus, RoutingMetrics metrics,
                         ExecutorService executor) {
        this.registry = registry;
        this.analyzer = analyzer;
        this.scoringEngine = scoringEngine;
        this.selector = selector;
        this.dispatcher = dispatcher;
        this.statsAggregator = statsAggregator;
        this.healthCheckService = healthCheckService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Registers a handler; a duplicate id replaces the prior registration.
     */
    public void register(HandlerDescriptor descriptor, Handler handler) {
        registry.register(descriptor, handler);
    }

    /**
     * Routes a task using its own description as the text to analyze.
     */
    public RoutingResult route(Task task) {
        return route(task.description(), task);
    }

    /**
     * Selects the best handler for {@code text}, executes {@code task} with it and records the outcome.
     *
     * @param text free-text description used for routing
     * @param task the task handed to the selected handler
     * @return the decision, outcome and handler result; the outcome is unsuccessful only when cancelled
     * @throws RoutingException {@link ErrorKind#EMPTY_REGISTRY} when no handler is registered (nothing
     *                          is recorded), {@link ErrorKind#COMPLETE_ROUTING_FAILURE} when the selected
     *                          and fallback handlers both fail (a failure record is appended)
     */
    public RoutingResult route(String text, Task task) {
        String routingId = generateRoutingId();
        MdcContext.setRouting(routingId, task.id());
        try {
            log.info("Routing task {}: {}", task.id(), abbreviate(text));
            RoutingDecision decision = decide(text);
            publish("route.selected", routingId, decision.selectedHandlerId(), Map.of(
                    "confidence", decision.confidence(),
                    "taskTypes", decision.taskProfile().taskTypes(),
                    "lowConfidence", decision.lowConfidence()));

            MdcContext.setHandler(decision.selectedHandlerId());
            DispatchResult dispatched = dispatcher.dispatch(decision, task);
            ExecutionOutcome outcome = dispatched.outcome();
            publishOutcome(routingId, decision, outcome);

            if (outcome.errorKind() == ErrorKind.COMPLETE_ROUTING_FAILURE) {
                throw new RoutingException(ErrorKind.COMPLETE_ROUTING_FAILURE,
                        "Both routing and fallback failed: " + outcome.errorMessage(),
                        decision, outcome, dispatched.failure());
            }
            return new RoutingResult(routingId, decision, outcome, dispatched.result());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs {@link #route(String, Task)} on the engine's worker pool. Cancelling the returned
     * future with {@code mayInterruptIfRunning=true} interrupts the handler; the dispatch is
     * then recorded with {@link ErrorKind#CANCELLED}.
     */
    public Future<RoutingResult> submit(String text, Task task) {
        return executor.submit(() -> route(text, task));
    }

    /**
     * Computes the routing decision for {@code text} without dispatching anything.
     *
     * @throws RoutingException {@link ErrorKind#EMPTY_REGISTRY} when no handler is registered
     */
    public RoutingDecision decide(String text) {
        var descriptors = registry.descriptors();
        if (descriptors.isEmpty()) {
            log.error("Cannot route: no handlers registered");
            if (metrics != null) {
                metrics.recordFailure(ErrorKind.EMPTY_REGISTRY);
            }
            throw new RoutingException(ErrorKind.EMPTY_REGISTRY, "No handlers registered");
        }
        TaskProfile profile = analyzer.analyze(text);
        RoutingDecision decision = selector.select(scoringEngine.scoreAll(profile, descriptors), profile);
        if (metrics != null) {
            metrics.recordDecision(decision.selectedHandlerId(), decision.confidence());
        }
        return decision;
    }

    public RoutingStats stats() {
        return statsAggregator.stats();
    }

    public HealthSnapshot healthCheck() {
        return healthCheckService.check();
    }

    /**
     * Generates a unique routing ID in the format ROUTE-YYYY-NNNN.
     */
    public String generateRoutingId() {
        int count = ROUTING_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("ROUTE-%d-%04d", year, count);
    }

    private void publishOutcome(String routingId, RoutingDecision decision, ExecutionOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("success", outcome.success());
        payload.put("durationMs", outcome.durationMs());
        payload.put("fallbackUsed", outcome.fallbackUsed());
        if (outcome.errorMessage() != null) {
            payload.put("error", outcome.errorMessage());
        }
        String eventType;
        if (outcome.errorKind() == ErrorKind.CANCELLED) {
            eventType = "dispatch.cancelled";
        } else if (!outcome.success()) {
            eventType = "dispatch.failed";
        } else if (outcome.fallbackUsed()) {
            eventType = "dispatch.fallback";
        } else {
            eventType = "dispatch.completed";
        }
        publish(eventType, routingId, decision.selectedHandlerId(), payload);
    }

    private void publish(String eventType, String routingId, String handlerId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new RoutingEvent(eventType, routingId, handlerId, Map.copyOf(payload), Instant.now()));
        }
    }

    private static String abbreviate(String text) {
        if (text == null || text.isEmpty()) return "(empty)";
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
