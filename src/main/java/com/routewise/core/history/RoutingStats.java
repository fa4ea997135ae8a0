package com.routewise.core.history;

import java.util.Map;

/**
 * Aggregate statistics computed from the current routing history.
 * Rates and confidences are fractions in [0, 1]; all values are 0 for an empty history.
 *
 * @param totalRoutes       number of records in history
 * @param successRate       successes / totalRoutes
 * @param averageConfidence mean decision confidence
 * @param usagePerHandler   selection count per selected handler id
 * @param fallbackCount     records whose dispatch invoked the fallback handler
 * @param averageDurationMs mean dispatch duration
 * @param handlerUsage      detailed per-handler aggregates
 */
public record RoutingStats(
    int totalRoutes,
    double successRate,
    double averageConfidence,
    Map<String, Long> usagePerHandler,
    long fallbackCount,
    double averageDurationMs,
    Map<String, HandlerUsage> handlerUsage
) {
    public static RoutingStats empty() {
        return new RoutingStats(0, 0.0, 0.0, Map.of(), 0, 0.0, Map.of());
    }
}
