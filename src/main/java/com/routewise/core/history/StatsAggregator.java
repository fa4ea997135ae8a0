package com.routewise.core.history;

import com.routewise.core.model.HistoryRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link RoutingStats} fresh from a {@link RoutingHistory} snapshot on every call.
 */
public class StatsAggregator {

    private final RoutingHistory history;

    public StatsAggregator(RoutingHistory history) {
        this.history = history;
    }

    public RoutingStats stats() {
        return aggregate(history.snapshot());
    }

    static RoutingStats aggregate(List<HistoryRecord> records) {
        if (records.isEmpty()) {
            return RoutingStats.empty();
        }

        long successes = 0;
        long fallbacks = 0;
        double confidenceSum = 0.0;
        double durationSum = 0.0;
        var perHandler = new LinkedHashMap<String, Accumulator>();

        for (var record : records) {
            boolean success = record.outcome().success();
            double confidence = record.decision().confidence();
            long duration = record.outcome().durationMs();

            if (success) successes++;
            if (record.outcome().fallbackUsed()) fallbacks++;
            confidenceSum += confidence;
            durationSum += duration;

            perHandler.computeIfAbsent(record.decision().selectedHandlerId(), k -> new Accumulator())
                    .add(success, confidence, duration);
        }

        int total = records.size();
        var usage = new LinkedHashMap<String, Long>();
        var handlerUsage = new LinkedHashMap<String, HandlerUsage>();
        perHandler.forEach((handlerId, acc) -> {
            usage.put(handlerId, acc.selections);
            handlerUsage.put(handlerId, acc.toUsage());
        });

        return new RoutingStats(
                total,
                (double) successes / total,
                confidenceSum / total,
                Collections.unmodifiableMap(usage),
                fallbacks,
                durationSum / total,
                Collections.unmodifiableMap(handlerUsage));
    }

    private static final class Accumulator {
        long selections;
        long successes;
        double confidenceSum;
        double durationSum;

        void add(boolean success, double confidence, long durationMs) {
            selections++;
            if (success) successes++;
            confidenceSum += confidence;
            durationSum += durationMs;
        }

        HandlerUsage toUsage() {
            return new HandlerUsage(selections, successes, confidenceSum / selections, durationSum / selections);
        }
    }
}
