package com.routewise.core.history;

/**
 * Per-handler aggregate over the routing history, keyed by the selected handler.
 *
 * @param selections        how many recorded decisions selected this handler
 * @param successes         how many of those dispatches ended successfully (including via fallback)
 * @param averageConfidence mean decision confidence
 * @param averageDurationMs mean dispatch duration
 */
public record HandlerUsage(
    long selections,
    long successes,
    double averageConfidence,
    double averageDurationMs
) {
    public double successRate() {
        return selections == 0 ? 0.0 : (double) successes / selections;
    }
}
