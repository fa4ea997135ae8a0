package com.routewise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declared capability metadata of a registered handler. Immutable once built.
 *
 * @param id                   unique handler identifier (e.g. "frontend")
 * @param description          human-readable summary
 * @param capabilities         capability tags (e.g. "ui-design", "accessibility")
 * @param tools                tool tags (e.g. "react", "docker")
 * @param primaryTaskTypes     task types this handler is the declared primary match for
 * @param secondaryTaskTypes   task types this handler is a declared secondary match for
 * @param domainAffinity       domain name to affinity in [0, 1]
 * @param complexityAdjustment per-complexity score multiplier; missing tiers default to 1.0
 */
public record HandlerDescriptor(
    String id,
    String description,
    Set<String> capabilities,
    Set<String> tools,
    Set<String> primaryTaskTypes,
    Set<String> secondaryTaskTypes,
    Map<String, Double> domainAffinity,
    Map<Complexity, Double> complexityAdjustment
) implements Serializable {

    /** Affinity applied for any domain the descriptor does not mention. */
    public static final double DEFAULT_DOMAIN_AFFINITY = 0.2;

    public HandlerDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Handler id must not be blank");
        }
        description = description == null ? "" : description;
        capabilities = copyOf(capabilities);
        tools = copyOf(tools);
        primaryTaskTypes = copyOf(primaryTaskTypes);
        secondaryTaskTypes = copyOf(secondaryTaskTypes);

        var affinity = new LinkedHashMap<String, Double>();
        if (domainAffinity != null) {
            domainAffinity.forEach((domain, value) -> {
                if (value == null || value < 0.0 || value > 1.0) {
                    throw new IllegalArgumentException(
                            "Domain affinity for '" + domain + "' on handler '" + id + "' must be in [0, 1]: " + value);
                }
                affinity.put(domain.toLowerCase(), value);
            });
        }
        domainAffinity = Collections.unmodifiableMap(affinity);

        var adjustments = new LinkedHashMap<Complexity, Double>();
        if (complexityAdjustment != null) {
            complexityAdjustment.forEach((tier, value) -> {
                if (value == null || value < 0.0) {
                    throw new IllegalArgumentException(
                            "Complexity adjustment for " + tier + " on handler '" + id + "' must be >= 0: " + value);
                }
                adjustments.put(tier, value);
            });
        }
        complexityAdjustment = Collections.unmodifiableMap(adjustments);
    }

    /**
     * Convenience factory for handlers that declare only tags and primary task types.
     */
    public static HandlerDescriptor of(String id, Set<String> capabilities, Set<String> primaryTaskTypes) {
        return new HandlerDescriptor(id, "", capabilities, Set.of(), primaryTaskTypes, Set.of(), Map.of(), Map.of());
    }

    public double affinityFor(String domain) {
        return domainAffinity.getOrDefault(domain, DEFAULT_DOMAIN_AFFINITY);
    }

    public double adjustmentFor(Complexity complexity) {
        return complexityAdjustment.getOrDefault(complexity, 1.0);
    }

    /**
     * Capability and tool tags combined, lower-cased, in declaration order.
     */
    public Set<String> tags() {
        var tags = new LinkedHashSet<String>();
        capabilities.forEach(c -> tags.add(c.toLowerCase()));
        tools.forEach(t -> tags.add(t.toLowerCase()));
        return tags;
    }

    private static Set<String> copyOf(Set<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        var copy = new LinkedHashSet<String>();
        for (String s : source) {
            if (s != null && !s.isBlank()) {
                copy.add(s.trim().toLowerCase());
            }
        }
        return Collections.unmodifiableSet(copy);
    }
}
