package com.routewise.core.config;

import com.routewise.core.analysis.TaskAnalyzer;
import com.routewise.core.dispatch.ExecutionDispatcher;
import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.events.EventBus;
import com.routewise.core.handler.AcknowledgingHandler;
import com.routewise.core.handler.Handler;
import com.routewise.core.health.HealthCheckService;
import com.routewise.core.history.RoutingHistory;
import com.routewise.core.history.StatsAggregator;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.registry.CapabilityRegistry;
import com.routewise.core.scoring.ScoringEngine;
import com.routewise.core.selection.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the routing engine from {@link RouterProperties}.
 * <p>
 * Handler descriptors come from {@code routewise.handlers}. A {@link Handler} bean whose
 * name equals a descriptor id executes that handler; descriptors without one are served
 * by an {@link AcknowledgingHandler}.
 */
@Configuration
public class RouterConfig {

    private static final Logger log = LoggerFactory.getLogger(RouterConfig.class);

    @Bean
    public CapabilityRegistry capabilityRegistry(RouterProperties properties, ListableBeanFactory beanFactory) {
        Map<String, Handler> handlerBeans = beanFactory.getBeansOfType(Handler.class);
        var registry = new CapabilityRegistry();
        for (var definition : properties.getHandlers()) {
            var descriptor = definition.toDescriptor();
            Handler handler = handlerBeans.get(descriptor.id());
            registry.register(descriptor, handler != null ? handler : new AcknowledgingHandler(descriptor));
        }
        String fallbackId = properties.getRouting().getFallbackHandlerId();
        if (registry.find(fallbackId).isEmpty()) {
            log.warn("Fallback handler '{}' is not among the {} configured handlers; primary failures will not be recovered",
                    fallbackId, registry.size());
        }
        log.info("Capability registry initialized with {} handlers: {}", registry.size(), registry.handlerIds());
        return registry;
    }

    @Bean
    public RoutingHistory routingHistory(RouterProperties properties) {
        return new RoutingHistory(properties.getHistory().getCapacity());
    }

    @Bean
    public StatsAggregator statsAggregator(RoutingHistory routingHistory) {
        return new StatsAggregator(routingHistory);
    }

    @Bean
    public Selector selector(RouterProperties properties) {
        return new Selector(properties.getRouting().getMinConfidence());
    }

    @Bean
    public ExecutionDispatcher executionDispatcher(CapabilityRegistry registry, RoutingHistory history,
                                                   RouterProperties properties, RoutingMetrics metrics) {
        return new ExecutionDispatcher(registry, history, properties.getRouting().getFallbackHandlerId(), metrics);
    }

    @Bean
    public HealthCheckService healthCheckService(CapabilityRegistry registry) {
        return new HealthCheckService(registry);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService routingExecutor(RouterProperties properties) {
        var counter = new AtomicInteger(0);
        return Executors.newFixedThreadPool(properties.getDispatch().getWorkerThreads(), r -> {
            var thread = new Thread(r, "routewise-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RoutingEngine routingEngine(CapabilityRegistry registry, TaskAnalyzer analyzer, ScoringEngine scoringEngine,
                                       Selector selector, ExecutionDispatcher dispatcher,
                                       StatsAggregator statsAggregator, HealthCheckService healthCheckService,
                                       EventBus eventBus, RoutingMetrics metrics, ExecutorService routingExecutor) {
        return new RoutingEngine(registry, analyzer, scoringEngine, selector, dispatcher, statsAggregator,
                healthCheckService, eventBus, metrics, routingExecutor);
    }
}
