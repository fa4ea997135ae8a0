package com.routewise.core.config;

import com.routewise.core.history.RoutingHistory;
import com.routewise.core.model.Complexity;
import com.routewise.core.model.HandlerDescriptor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "routewise")
public class RouterProperties {

    private History history = new History();
    private Routing routing = new Routing();
    private Dispatch dispatch = new Dispatch();
    private List<HandlerDefinition> handlers = new ArrayList<>();

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public List<HandlerDefinition> getHandlers() {
        return handlers;
    }

    public void setHandlers(List<HandlerDefinition> handlers) {
        this.handlers = handlers;
    }

    public static class History {
        private int capacity = RoutingHistory.DEFAULT_CAPACITY;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class Routing {
        private double minConfidence = 0.5;
        private String fallbackHandlerId = "generalist";

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public String getFallbackHandlerId() {
            return fallbackHandlerId;
        }

        public void setFallbackHandlerId(String fallbackHandlerId) {
            this.fallbackHandlerId = fallbackHandlerId;
        }
    }

    public static class Dispatch {
        private int workerThreads = 4;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    /**
     * A handler descriptor as declared in configuration.
     */
    public static class HandlerDefinition {
        private String id;
        private String description = "";
        private List<String> capabilities = List.of();
        private List<String> tools = List.of();
        private List<String> primaryTaskTypes = List.of();
        private List<String> secondaryTaskTypes = List.of();
        private Map<String, Double> domainAffinity = new LinkedHashMap<>();
        private Map<Complexity, Double> complexityAdjustment = new LinkedHashMap<>();

        public HandlerDescriptor toDescriptor() {
            return new HandlerDescriptor(id, description,
                    new LinkedHashSet<>(capabilities), new LinkedHashSet<>(tools),
                    new LinkedHashSet<>(primaryTaskTypes), new LinkedHashSet<>(secondaryTaskTypes),
                    domainAffinity, complexityAdjustment);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(List<String> capabilities) {
            this.capabilities = capabilities;
        }

        public List<String> getTools() {
            return tools;
        }

        public void setTools(List<String> tools) {
            this.tools = tools;
        }

        public List<String> getPrimaryTaskTypes() {
            return primaryTaskTypes;
        }

        public void setPrimaryTaskTypes(List<String> primaryTaskTypes) {
            this.primaryTaskTypes = primaryTaskTypes;
        }

        public List<String> getSecondaryTaskTypes() {
            return secondaryTaskTypes;
        }

        public void setSecondaryTaskTypes(List<String> secondaryTaskTypes) {
            this.secondaryTaskTypes = secondaryTaskTypes;
        }

        public Map<String, Double> getDomainAffinity() {
            return domainAffinity;
        }

        public void setDomainAffinity(Map<String, Double> domainAffinity) {
            this.domainAffinity = domainAffinity;
        }

        public Map<Complexity, Double> getComplexityAdjustment() {
            return complexityAdjustment;
        }

        public void setComplexityAdjustment(Map<Complexity, Double> complexityAdjustment) {
            this.complexityAdjustment = complexityAdjustment;
        }
    }
}
